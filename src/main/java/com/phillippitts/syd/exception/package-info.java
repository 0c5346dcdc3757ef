/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.syd.exception.SydException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.syd.exception.ConfigurationException} - Thrown when caller
 *       input cannot be resolved (fatal to resolution, raised before any per-star work)</li>
 *   <li>{@link com.phillippitts.syd.exception.ProcessingException} - Thrown when a single
 *       star fails during processing (isolated, never aborts a batch)</li>
 * </ul>
 *
 * <p>Numerical degeneracies (empty or flat series) are not exceptions: the numeric utilities
 * return empty results and {@code NaN} sentinels instead.
 *
 * @see com.phillippitts.syd.exception.SydException
 * @since 1.0
 */
package com.phillippitts.syd.exception;
