/**
 * Interop between event-loop scheduled work and blocking call sites.
 * This includes the unit-of-work abstraction, the process-wide facade, background task
 * retention, blocking-call offloading, the loop bridge and blocking twins of scheduled methods.
 */
package com.sailfish.interop;
