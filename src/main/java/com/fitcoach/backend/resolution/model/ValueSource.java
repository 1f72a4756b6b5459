package com.fitcoach.backend.resolution.model;

public enum ValueSource {
    /** 目前 active 的 plan row */
    PLAN,
    /** active Budget 模板本身 */
    PROGRAM,
    NONE
}
