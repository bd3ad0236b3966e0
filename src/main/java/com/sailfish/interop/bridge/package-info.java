/**
 * Driving scheduled work to completion from blocking call sites, including from inside a running loop.
 */
package com.sailfish.interop.bridge;
