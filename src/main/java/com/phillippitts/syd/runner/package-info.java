/**
 * Application startup entry point tying resolution, dispatch and aggregation together.
 */
package com.phillippitts.syd.runner;
