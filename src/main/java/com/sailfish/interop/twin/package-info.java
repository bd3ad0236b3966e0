/**
 * Blocking twins of scheduled methods. A type lists its twins once, in a {@link
 * com.sailfish.interop.twin.SyncTwinTable} built from method references, typically held in a
 * static field of the type itself:
 *
 * <pre>
 * static final SyncTwinTable&lt;Counter&gt; TWINS = SyncTwinTable.builder(Counter.class)
 *         .twin("increment", Integer.class, Counter::incrementAsync)
 *         .build();
 *
 * BoundTwins&lt;Counter&gt; blocking = AsyncUtils.syncTwins().bind(counter, Counter.TWINS);
 * int answer = blocking.callNonNull("increment", 41); // 42
 * </pre>
 */
package com.sailfish.interop.twin;
