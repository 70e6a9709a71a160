package com.vidnyan.cstfix.domain.rule;

public enum ActionCategory {
    QUICK_FIX,
    REFACTOR
}
