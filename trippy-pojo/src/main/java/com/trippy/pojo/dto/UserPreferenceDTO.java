package com.trippy.pojo.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 前端上传的用户偏好快照。
 * likedItems / dislikedItems 仅用于新用户建档与多人推荐加成，打分本身只看 interaction 记录。
 */
@Data
public class UserPreferenceDTO {

    private String userId;

    private Integer age;

    private List<String> likedItems = new ArrayList<>();

    private List<String> dislikedItems = new ArrayList<>();

    private List<String> travelHistory = new ArrayList<>();
}
