package com.trippy.pojo.dto;

import lombok.Data;

@Data
public class ConfidenceCheckDTO {

    private String userId;

    private String destination;
}
