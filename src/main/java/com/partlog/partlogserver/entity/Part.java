package com.partlog.partlogserver.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Entity
@Table(name = "parts")
@Getter
@Setter
@NoArgsConstructor
public class Part extends AbstractNamedDBElement {

    private String description;
    private String category;
    private BigDecimal minAmount = BigDecimal.ZERO;
    private boolean favorite;

    @OneToMany(mappedBy = "part")
    private List<PartLot> partLots = new ArrayList<>();

    @OneToMany(mappedBy = "part")
    private List<Orderdetail> orderdetails = new ArrayList<>();

    @OneToMany(mappedBy = "element")
    private List<Attachment> attachments = new ArrayList<>();

    public Part(String name) {
        setName(name);
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.PART;
    }

    @Override
    public Map<String, Object> readFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("name", getName());
        fields.put("description", description);
        fields.put("category", category);
        fields.put("minAmount", minAmount);
        fields.put("favorite", favorite);
        return fields;
    }
}
