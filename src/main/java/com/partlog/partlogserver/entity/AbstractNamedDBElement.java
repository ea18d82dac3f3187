package com.partlog.partlogserver.entity;

import jakarta.persistence.MappedSuperclass;
import lombok.Getter;
import lombok.Setter;

@MappedSuperclass
@Getter
@Setter
public abstract class AbstractNamedDBElement extends AbstractDBElement {

    private String name;
}
