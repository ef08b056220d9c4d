/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.terrarium.exception.TerrariumException} - Base exception
 *       for all supervisor errors</li>
 *   <li>{@link com.phillippitts.terrarium.exception.ConfigurationException} - A configuration
 *       document exists but is unreadable or malformed</li>
 *   <li>{@link com.phillippitts.terrarium.exception.ServiceRestartException} - The watchdog
 *       could not restart a supervised service</li>
 *   <li>{@link com.phillippitts.terrarium.exception.CycleExecutionException} - One control-loop
 *       cycle failed</li>
 *   <li>{@link com.phillippitts.terrarium.exception.ControlServiceException} - The control
 *       collaborator failed to initialize or start</li>
 * </ul>
 *
 * <p>Inner helpers throw these types; only the loop boundaries (event handler invocation,
 * cycle execution, restart attempts) turn them into "log and continue". No exception in
 * this hierarchy is meant to terminate the process.
 *
 * @see com.phillippitts.terrarium.exception.TerrariumException
 */
package com.phillippitts.terrarium.exception;
