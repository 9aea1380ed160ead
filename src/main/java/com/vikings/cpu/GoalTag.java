package com.vikings.cpu;

/**
 * Why a candidate move was proposed.
 */
public enum GoalTag {
    NORMAL,
    REINFORCE
}
