package com.trippy.pojo.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.trippy.pojo.model.ItemKind;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 用户对地点/活动的一次喜欢或不喜欢，对应 interaction 表。
 * rating 只有 +1 / -1 两种取值；同一 (user, item) 的多次记录不去重，按原样参与打分。
 */
@Data
@NoArgsConstructor
@TableName("interaction")
public class Interaction {

    public static final int LIKE = 1;
    public static final int DISLIKE = -1;

    @TableId(type = IdType.AUTO)
    private Long id;

    private String userId;

    private String itemId;

    private ItemKind itemType;

    private Integer rating;

    private LocalDateTime timestamp;

    public Interaction(String userId, String itemId, ItemKind itemType, int rating, LocalDateTime timestamp) {
        this.userId = userId;
        this.itemId = itemId;
        this.itemType = itemType;
        this.rating = rating;
        this.timestamp = timestamp;
    }

    public boolean isLike() {
        return rating != null && rating > 0;
    }

    public boolean isDislike() {
        return rating != null && rating < 0;
    }
}
