package com.partlog.partlogserver.entity;

public enum Role {
    ADMIN,
    EDITOR,
    READ_ONLY
}
