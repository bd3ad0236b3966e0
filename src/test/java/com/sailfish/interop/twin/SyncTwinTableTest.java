package com.sailfish.interop.twin;

import com.sailfish.interop.AsyncWork;
import com.sailfish.interop.loop.SingleThreadEventLoop;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SyncTwinTableTest {

    public static class Downloader {

        public AsyncWork<String> downloadAsync(String url) {
            return AsyncWork.completed("content of " + url);
        }

        public AsyncWork<Integer> sizeAsync(String url) {
            return AsyncWork.completed(url.length());
        }
    }

    public static class Renderer {

        public AsyncWork<String> renderText(String text) {
            return AsyncWork.completed("text:" + text);
        }

        public AsyncWork<String> renderNumber(Integer number) {
            return AsyncWork.completed("number:" + number);
        }

        public AsyncWork<String> storeString(String value) {
            return AsyncWork.completed(value);
        }

        public AsyncWork<String> storeChars(CharSequence value) {
            return AsyncWork.completed("chars:" + value);
        }
    }

    private static final SyncTwinTable<Downloader> DOWNLOADER = SyncTwinTable.builder(Downloader.class)
            .twin("size", String.class, Downloader::sizeAsync)
            .twin("download", String.class, Downloader::downloadAsync)
            .build();

    private static final SyncTwinTable<Renderer> RENDERER = SyncTwinTable.builder(Renderer.class)
            .twin("render", String.class, Renderer::renderText)
            .twin("render", Integer.class, Renderer::renderNumber)
            .twin("store", String.class, Renderer::storeString)
            .twin("store", CharSequence.class, Renderer::storeChars)
            .build();

    private static <T> T await(AsyncWork<?> work) {
        @SuppressWarnings("unchecked")
        AsyncWork<T> typed = (AsyncWork<T>) work;
        return new SingleThreadEventLoop().runUntilComplete(typed);
    }

    @Test
    void shouldListRegisteredTwinsSorted() {
        assertThat(DOWNLOADER.twinNames()).containsExactly("download", "size");
        assertThat(DOWNLOADER.getType()).isEqualTo(Downloader.class);
        assertThat(DOWNLOADER.twins("sizeAsync")).isEmpty();
    }

    @Test
    void shouldDescribeTwin() {
        SyncTwin<Downloader> size = DOWNLOADER.find("size", String.class).orElseThrow();

        assertThat(size.getName()).isEqualTo("size");
        assertThat(size.getArity()).isEqualTo(1);
        assertThat(size.getParameterTypes()).containsExactly(String.class);
        assertThat(size.toString()).isEqualTo("SyncTwin[size(String) on Downloader]");
    }

    @Test
    void shouldOpenWorkOfRegisteredMethod() {
        SyncTwin<Downloader> size = DOWNLOADER.find("size", String.class).orElseThrow();

        Integer result = await(size.open(new Downloader(), new Object[]{"abcd"}));

        assertThat(result).isEqualTo(4);
    }

    @Test
    void shouldFindTwinByExactParameterTypes() {
        assertThat(DOWNLOADER.find("download", String.class)).isPresent();
        assertThat(DOWNLOADER.find("download", Object.class)).isEmpty();
        assertThat(DOWNLOADER.find("download")).isEmpty();
    }

    @Test
    void shouldResolveOverloadsByArgumentType() {
        String text = await(RENDERER.resolve("render", "x").open(new Renderer(), new Object[]{"x"}));
        String number = await(RENDERER.resolve("render", 5).open(new Renderer(), new Object[]{5}));

        assertThat(RENDERER.twins("render")).hasSize(2);
        assertThat(text).isEqualTo("text:x");
        assertThat(number).isEqualTo("number:5");
    }

    @Test
    void shouldRejectAmbiguousCall() {
        assertThatThrownBy(() -> RENDERER.resolve("store", "x"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ambiguous")
                .hasMessageContaining("store(String)")
                .hasMessageContaining("store(CharSequence)");
    }

    @Test
    void shouldResolveUnambiguousOverloadOfSharedName() {
        StringBuilder chars = new StringBuilder("sb");

        String stored = await(RENDERER.resolve("store", chars).open(new Renderer(), new Object[]{chars}));

        assertThat(stored).isEqualTo("chars:sb");
    }

    @Test
    void shouldRejectCallMatchingNoTwin() {
        assertThatThrownBy(() -> RENDERER.resolve("render", 1.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("accepts");
        assertThatThrownBy(() -> RENDERER.resolve("render", "a", "b"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("accepts 2 arguments");
        assertThatThrownBy(() -> RENDERER.resolve("missing"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("No sync twin named 'missing'");
    }

    @Test
    void shouldRejectTargetOfAnotherType() {
        SyncTwin<Downloader> size = DOWNLOADER.find("size", String.class).orElseThrow();

        assertThatThrownBy(() -> size.open(new Renderer(), new Object[]{"x"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cannot be called on")
                .hasMessageContaining(Renderer.class.getName());
    }

    @Test
    void shouldRejectScheduledMethodReturningNoWork() {
        SyncTwinTable<Downloader> table = SyncTwinTable.builder(Downloader.class)
                .twin("nothing", downloader -> null)
                .build();
        SyncTwin<Downloader> nothing = table.find("nothing").orElseThrow();

        assertThatThrownBy(() -> nothing.open(new Downloader(), new Object[0]))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("returned null instead of work");
    }

    @Test
    void shouldRejectBlankTwinName() {
        SyncTwinTable.Builder<Downloader> builder = SyncTwinTable.builder(Downloader.class);

        assertThatThrownBy(() -> builder.twin("  ", String.class, Downloader::sizeAsync))
                .isInstanceOf(SyncTwinDeclarationException.class)
                .hasMessageContaining("Blank");
    }

    @Test
    void shouldRejectTwinNameThatIsNotAnIdentifier() {
        SyncTwinTable.Builder<Downloader> builder = SyncTwinTable.builder(Downloader.class);

        assertThatThrownBy(() -> builder.twin("not a name", String.class, Downloader::sizeAsync))
                .isInstanceOf(SyncTwinDeclarationException.class)
                .hasMessageContaining("not a valid method name");
    }

    @Test
    void shouldRejectPrimitiveParameterType() {
        SyncTwinTable.Builder<Downloader> builder = SyncTwinTable.builder(Downloader.class);

        assertThatThrownBy(() -> builder.twin("count", int.class, (Downloader d, Integer x) -> AsyncWork.completed(x)))
                .isInstanceOf(SyncTwinDeclarationException.class)
                .hasMessageContaining("wrapper");
    }

    @Test
    void shouldRejectTwoMethodsClaimingSameTwin() {
        SyncTwinTable.Builder<Downloader> builder = SyncTwinTable.builder(Downloader.class)
                .twin("fetch", String.class, Downloader::downloadAsync);

        assertThatThrownBy(() -> builder.twin("fetch", String.class, Downloader::sizeAsync))
                .isInstanceOf(SyncTwinDeclarationException.class)
                .hasMessageContaining("'fetch(String)'")
                .hasMessageContaining("registered twice");
    }

    @Test
    void shouldNotBeAffectedByBuilderAfterBuild() {
        SyncTwinTable.Builder<Downloader> builder = SyncTwinTable.builder(Downloader.class)
                .twin("size", String.class, Downloader::sizeAsync);
        SyncTwinTable<Downloader> table = builder.build();

        builder.twin("download", String.class, Downloader::downloadAsync);

        assertThat(table.twinNames()).containsExactly("size");
    }
}
