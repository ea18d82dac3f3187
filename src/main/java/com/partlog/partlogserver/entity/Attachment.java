package com.partlog.partlogserver.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

@Entity
@Table(name = "attachments")
@Getter
@Setter
@NoArgsConstructor
public class Attachment extends AbstractNamedDBElement {

    private String path;
    private boolean showInTable;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "element_id")
    private Part element;

    @Override
    public EntityKind getKind() {
        return EntityKind.ATTACHMENT;
    }

    @Override
    public Map<String, Object> readFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("name", getName());
        fields.put("path", path);
        fields.put("showInTable", showInTable);
        fields.put("element", element);
        return fields;
    }
}
