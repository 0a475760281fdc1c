package com.uclang.compiler.analysis;

/**
 * 诊断分类
 */
public enum ErrorKind {
    /** 同一作用域内的重复名称（类型、函数、字段、变量、参数） */
    REDEFINITION,
    /** 未定义的类型、函数或变量 */
    UNDEFINED_NAME,
    /** 类型不兼容、非左值、数组误用、返回类型不符、参数个数不符等 */
    TYPE,
    /** 循环外的 break / continue */
    CONTROL_FLOW
}
