/**
 * The host event loop: a minimal cooperative scheduler and the per-thread query telling whether
 * one is running.
 */
package com.sailfish.interop.loop;
