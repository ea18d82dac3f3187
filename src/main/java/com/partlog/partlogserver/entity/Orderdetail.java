package com.partlog.partlogserver.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Данные поставщика для детали.
 */
@Entity
@Table(name = "orderdetails")
@Getter
@Setter
@NoArgsConstructor
public class Orderdetail extends AbstractDBElement {

    private String supplierPartNr;
    private String supplierProductUrl;
    private boolean obsolete;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "part_id")
    private Part part;

    @OneToMany(mappedBy = "orderdetail")
    private List<Pricedetail> pricedetails = new ArrayList<>();

    public Orderdetail(Part part, String supplierPartNr) {
        this.part = part;
        this.supplierPartNr = supplierPartNr;
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.ORDERDETAIL;
    }

    @Override
    public Map<String, Object> readFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("supplierPartNr", supplierPartNr);
        fields.put("supplierProductUrl", supplierProductUrl);
        fields.put("obsolete", obsolete);
        fields.put("part", part);
        return fields;
    }
}
