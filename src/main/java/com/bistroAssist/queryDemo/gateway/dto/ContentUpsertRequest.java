package com.bistroAssist.queryDemo.gateway.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Raw content fields to index, e.g. name/description/price for a menu item.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContentUpsertRequest {

    @NotEmpty(message = "fields cannot be empty")
    private Map<String, Object> fields;
}
