package com.trippy.server.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.trippy.pojo.entity.Interaction;
import com.trippy.pojo.model.ItemKind;
import com.trippy.server.mapper.InteractionMapper;
import com.trippy.server.service.InteractionService;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

@Service
public class InteractionServiceImpl extends ServiceImpl<InteractionMapper, Interaction> implements InteractionService {

    @Override
    public List<Interaction> listByUser(String userId) {
        return lambdaQuery()
                .eq(Interaction::getUserId, userId)
                .orderByAsc(Interaction::getId)
                .list();
    }

    @Override
    public Interaction append(String userId, String itemId, ItemKind itemType, int rating) {
        Interaction interaction = new Interaction(userId, itemId, itemType, rating, LocalDateTime.now());
        save(interaction);
        return interaction;
    }
}
