package com.adaptivetrader.domain.enums;

/**
 * How the trade gate treats a signal pattern with no recorded outcomes.
 *
 * <ul>
 *   <li>EXPLORE -- approve, so new patterns can accumulate statistics (default)</li>
 *   <li>DENY -- reject until outcomes exist (conservative mode)</li>
 * </ul>
 */
public enum UnseenPatternPolicy {
    EXPLORE,
    DENY
}
