package com.phillippitts.fleetdump.domain;

/**
 * How a dump job interacts with the operator.
 *
 * <ul>
 *   <li>{@link #INTERACTIVE} - an operator watches progress, may cancel, and is notified on completion</li>
 *   <li>{@link #HEADLESS} - no operator; periodic status updates only, failures surface through counts</li>
 * </ul>
 */
public enum DumpMode {
    INTERACTIVE,
    HEADLESS
}
