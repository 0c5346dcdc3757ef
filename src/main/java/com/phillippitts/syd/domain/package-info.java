/**
 * Value types shared across pipeline stages: resolved star configurations, worker groups and
 * per-star results.
 */
package com.phillippitts.syd.domain;
