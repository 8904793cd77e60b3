package com.trippy.server.recommend;

import com.trippy.pojo.entity.Interaction;
import com.trippy.pojo.model.ItemFeatures;
import com.trippy.pojo.model.ItemKind;
import com.trippy.pojo.model.RecommendableItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContentBasedFilterTest {

    private static final double EPS = 1e-9;

    @Mock
    private RecommendationDataAccessor dataAccessor;

    private ContentBasedFilter filter;

    @BeforeEach
    void setUp() {
        filter = new ContentBasedFilter(dataAccessor);
    }

    @Test
    void noInteractions_shouldGiveEveryCandidateNeutralScore() {
        List<RecommendableItem> candidates = Arrays.asList(
                item("p1", "museum", "low", "cultural", "history"),
                item("p2", "bar", "high", "nightlife"));

        Map<String, Double> scores = filter.recommend(Collections.emptyList(), candidates, 10);

        assertEquals(2, scores.size());
        assertEquals(ContentBasedFilter.NEUTRAL_SCORE, scores.get("p1"), EPS);
        assertEquals(ContentBasedFilter.NEUTRAL_SCORE, scores.get("p2"), EPS);
    }

    @Test
    void onlyDislikes_shouldLeaveProfileEmptyAndFallBackToNeutral() {
        List<Interaction> interactions = Arrays.asList(
                dislike("p1"),
                dislike("p2"));

        Map<String, Double> profile = filter.extractProfile(interactions);
        Map<String, Double> scores = filter.recommend(interactions,
                Collections.singletonList(item("p3", "park", "medium", null)), 10);

        assertTrue(profile.isEmpty());
        assertEquals(ContentBasedFilter.NEUTRAL_SCORE, scores.get("p3"), EPS);
        verify(dataAccessor, never()).getItemById(anyString(), any());
    }

    @Test
    void extractProfile_shouldDivideByTotalRating() {
        RecommendableItem museum = item("p1", "museum", "low", "cultural", "history");
        RecommendableItem park = item("p2", "park", "low", null, "history", "nature");
        when(dataAccessor.getItemById("p1", ItemKind.PLACE)).thenReturn(Optional.of(museum));
        when(dataAccessor.getItemById("p2", ItemKind.PLACE)).thenReturn(Optional.of(park));

        Map<String, Double> profile = filter.extractProfile(Arrays.asList(like("p1"), like("p2"), dislike("p3")));

        assertEquals(0.5, profile.get("museum"), EPS);
        assertEquals(0.5, profile.get("park"), EPS);
        assertEquals(1.0, profile.get("low"), EPS);
        assertEquals(1.0, profile.get("history"), EPS);
        assertEquals(0.5, profile.get("nature"), EPS);
        assertEquals(0.5, profile.get("cultural"), EPS);
    }

    @Test
    void scoreItem_shouldSmoothByMatchCountAndWeightTagsAtHalf() {
        RecommendableItem liked = item("p1", "museum", "low", "cultural", "history", "art");
        when(dataAccessor.getItemById("p1", ItemKind.PLACE)).thenReturn(Optional.of(liked));
        Map<String, Double> profile = filter.extractProfile(Collections.singletonList(like("p1")));

        // category 1 + energy 1 + 两个标签 0.5 * 2 + age profile 1 = 4，共 5 个匹配
        double same = filter.scoreItem(item("p9", "museum", "low", "cultural", "history", "art"), profile);
        double unrelated = filter.scoreItem(item("p8", "bar", "high", "nightlife", "drinks"), profile);

        assertEquals(4.0 / 6.0, same, EPS);
        assertEquals(0.0, unrelated, EPS);
    }

    @Test
    void unresolvedLikedItems_shouldBeSkipped() {
        when(dataAccessor.getItemById("gone", ItemKind.PLACE)).thenReturn(Optional.empty());

        Map<String, Double> scores = filter.recommend(Collections.singletonList(like("gone")),
                Collections.singletonList(item("p1", "park", "medium", null)), 10);

        assertEquals(ContentBasedFilter.NEUTRAL_SCORE, scores.get("p1"), EPS);
    }

    @Test
    void scores_shouldStayWithinUnitInterval() {
        RecommendableItem a = item("p1", "museum", "low", "cultural", "history", "art");
        RecommendableItem b = item("p2", "museum", "low", "cultural", "history", "art", "architecture");
        when(dataAccessor.getItemById("p1", ItemKind.PLACE)).thenReturn(Optional.of(a));
        when(dataAccessor.getItemById("p2", ItemKind.PLACE)).thenReturn(Optional.of(b));

        List<RecommendableItem> candidates = Arrays.asList(a, b,
                item("p3", "museum", null, null),
                item("p4", "bar", "high", "nightlife"));
        Map<String, Double> scores = filter.recommend(Arrays.asList(like("p1"), like("p2"), like("p1")), candidates, 10);

        assertEquals(4, scores.size());
        for (double score : scores.values()) {
            assertTrue(score >= 0.0 && score <= 1.0, "score=" + score);
        }
    }

    @Test
    void recommend_shouldTruncateToTopNInDescendingOrder() {
        RecommendableItem liked = item("p1", "museum", "low", "cultural");
        when(dataAccessor.getItemById("p1", ItemKind.PLACE)).thenReturn(Optional.of(liked));

        List<RecommendableItem> candidates = Arrays.asList(
                item("p2", "bar", "high", "nightlife"),
                item("p3", "museum", "high", null),
                item("p4", "museum", "low", "cultural"));
        Map<String, Double> scores = filter.recommend(Collections.singletonList(like("p1")), candidates, 2);

        assertEquals(Arrays.asList("p4", "p3"), Arrays.asList(scores.keySet().toArray(new String[0])));
    }

    private static Interaction like(String itemId) {
        return new Interaction("u1", itemId, ItemKind.PLACE, Interaction.LIKE, LocalDateTime.now());
    }

    private static Interaction dislike(String itemId) {
        return new Interaction("u1", itemId, ItemKind.PLACE, Interaction.DISLIKE, LocalDateTime.now());
    }

    private static RecommendableItem item(String id, String category, String energy, String ageProfile, String... tags) {
        ItemFeatures features = new ItemFeatures();
        features.setEnergyLevel(energy);
        features.setAgeSuitabilityProfile(ageProfile);
        features.setTags(Arrays.asList(tags));
        return RecommendableItem.builder()
                .kind(ItemKind.PLACE)
                .id(id)
                .name(id)
                .category(category)
                .features(features)
                .build();
    }
}
