package com.company.dashboards.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SchemaField implements Serializable {
    private static final long serialVersionUID = 1L;

    private String name;
    private String type;
}
