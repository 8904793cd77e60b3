package com.trippy.pojo.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class GroupConfidenceCheckDTO {

    private List<String> participantIds = new ArrayList<>();

    private String destination;
}
