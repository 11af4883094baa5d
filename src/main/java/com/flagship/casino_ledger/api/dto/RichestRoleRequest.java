package com.flagship.casino_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RichestRoleRequest {

    /** Null switches the richest-member role off. */
    @JsonProperty("role_id")
    private String roleId;
}
