package com.signalpro.signal.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class KeyStatisticInput {

    private String value;
    private String label;
    private Boolean favorable;   // null 視為 true
}
