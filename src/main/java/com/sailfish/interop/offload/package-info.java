/**
 * Offloading of blocking calls to a bounded worker pool, awaitable from scheduled work.
 */
package com.sailfish.interop.offload;
