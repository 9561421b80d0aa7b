package com.metrocrawler.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LineDocument {
    private String id;

    @Builder.Default
    private Map<String, String> names = new LinkedHashMap<>();

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String color;
}
