package com.partlog.partlogserver.entity.log;

public interface LogWithComment {

    boolean hasComment();

    String getComment();

    LogWithComment setComment(String comment);
}
