/**
 * Retention of fire-and-forget background tasks until they reach a terminal state.
 */
package com.sailfish.interop.task;
