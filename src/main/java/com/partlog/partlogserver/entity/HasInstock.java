package com.partlog.partlogserver.entity;

import java.math.BigDecimal;

public interface HasInstock {
    BigDecimal getAmount();
}
