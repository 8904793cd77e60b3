package com.trippy.server.recommend;

import com.trippy.common.properties.RecommendProperties;
import com.trippy.pojo.entity.Interaction;
import com.trippy.pojo.entity.TravelUser;
import com.trippy.pojo.model.CandidateItems;
import com.trippy.pojo.model.ItemFeatures;
import com.trippy.pojo.model.ItemKind;
import com.trippy.pojo.model.RecommendableItem;
import com.trippy.server.metrics.MetricsRecorder;
import com.trippy.server.semantic.SemanticSimilarityProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * 混合排序引擎单元测试：协同过滤 / 内容打分使用真实实现，数据访问与语义检索使用 Mock；
 * 打分线程池替换为同步执行，保证测试确定性。
 */
@ExtendWith(MockitoExtension.class)
class HybridRecommendationEngineTest {

    private static final double EPS = 1e-9;
    private static final String DEST = "Lisbon";

    @Mock
    private RecommendationDataAccessor dataAccessor;

    @Mock
    private SemanticSimilarityProvider semanticProvider;

    @Mock
    private MetricsRecorder metricsRecorder;

    private RecommendProperties recommendProperties;
    private HybridRecommendationEngine engine;

    private final RecommendableItem club = item("club", "club", "high", "nightlife");
    private final RecommendableItem park = item("park", "park", null, null);
    private final RecommendableItem zoo = item("zoo", "zoo", "medium", "family");

    @BeforeEach
    void setUp() {
        recommendProperties = new RecommendProperties();
        engine = new HybridRecommendationEngine(
                dataAccessor,
                new CollaborativeFilter(dataAccessor, recommendProperties),
                new ContentBasedFilter(dataAccessor),
                semanticProvider,
                new AgeSuitabilityScorer(),
                recommendProperties,
                metricsRecorder,
                Runnable::run);
    }

    @Test
    void coldStartUser_shouldBeRankedByAgeMultiplierOnly() {
        TravelUser user = user("u1", 20);
        stubColdStart(user);

        List<ScoredItem> result = engine.getRecommendations(user, DEST, 10);

        assertEquals(3, result.size());
        assertEquals("club", result.get(0).getItem().getId());
        assertEquals("park", result.get(1).getItem().getId());
        assertEquals("zoo", result.get(2).getItem().getId());
        assertEquals(0.15 * 1.3, result.get(0).getScore(), EPS);
        assertEquals(0.15 * 1.0, result.get(1).getScore(), EPS);
        assertEquals(0.15 * 0.9, result.get(2).getScore(), EPS);
        for (ScoredItem scored : result) {
            assertEquals(0.0, scored.getCollabScore(), EPS);
            assertEquals(ContentBasedFilter.NEUTRAL_SCORE, scored.getContentScore(), EPS);
            assertEquals(0.0, scored.getSemanticScore(), EPS);
        }
    }

    @Test
    void missingAge_shouldFallBackToDefaultAge() {
        TravelUser user = user("u1", null);
        stubColdStart(user);

        List<ScoredItem> result = engine.getRecommendations(user, DEST, 10);

        // 默认 25 岁：俱乐部 1.3，亲子 1.2，中等能量 1.1
        assertEquals(Arrays.asList("club", "zoo", "park"), ids(result));
    }

    @Test
    void result_shouldBeBoundedByTopN() {
        TravelUser user = user("u1", 20);
        stubColdStart(user);

        List<ScoredItem> result = engine.getRecommendations(user, DEST, 2);

        assertEquals(Arrays.asList("club", "park"), ids(result));
        verify(semanticProvider).query(anyList(), anyList(), eq(DEST), eq(6));
    }

    @Test
    void repeatedCalls_shouldReturnSameRanking() {
        TravelUser user = user("u1", 40);
        stubColdStart(user);

        List<ScoredItem> first = engine.getRecommendations(user, DEST, 10);
        List<ScoredItem> second = engine.getRecommendations(user, DEST, 10);

        assertEquals(ids(first), ids(second));
        for (int i = 0; i < first.size(); i++) {
            assertEquals(first.get(i).getScore(), second.get(i).getScore(), EPS);
        }
    }

    @Test
    void semanticFailure_shouldDegradeToRemainingSignals() {
        TravelUser user = user("u1", 20);
        stubColdStart(user);
        when(semanticProvider.query(anyList(), anyList(), anyString(), anyInt()))
                .thenThrow(new IllegalStateException("index down"));

        List<ScoredItem> result = engine.getRecommendations(user, DEST, 10);

        assertEquals(3, result.size());
        verify(metricsRecorder).recordScorerFailure("semantic");
    }

    @Test
    void upsertFailure_shouldNotFailRanking() {
        TravelUser user = user("u1", 20);
        stubColdStart(user);
        doThrow(new IllegalStateException("index down")).when(semanticProvider).upsert(anyList());

        assertEquals(3, engine.getRecommendations(user, DEST, 10).size());
    }

    @Test
    void nonPositiveTopN_shouldReturnEmptyWithoutReadingData() {
        TravelUser user = user("u1", 20);

        assertTrue(engine.getRecommendations(user, DEST, 0).isEmpty());
        assertTrue(engine.getRecommendations(user, DEST, -3).isEmpty());
        verifyNoInteractions(dataAccessor, semanticProvider);
    }

    @Test
    void unknownDestination_shouldReturnEmpty() {
        TravelUser user = user("u1", 20);
        when(dataAccessor.getCandidateItems("Atlantis")).thenReturn(CandidateItems.empty());

        assertTrue(engine.getRecommendations(user, "Atlantis", 10).isEmpty());
        verifyNoInteractions(semanticProvider);
    }

    @Test
    void merge_shouldWeightSignalsAndSkipNonCandidates() {
        TravelUser user = user("u1", 30);
        RecommendableItem a = item("a", "park", null, null);
        RecommendableItem b = item("b", "park", null, null);
        RecommendableItem c = item("c", "park", null, null);

        Map<String, Double> collab = scores("a", 1.0);
        Map<String, Double> content = scores("a", 0.5, "b", 0.5);
        Map<String, Double> semantic = scores("c", 1.0, "ghost", 0.9);

        List<ScoredItem> merged = engine.merge(user, Arrays.asList(a, b, c), collab, content, semantic);

        assertEquals(Arrays.asList("a", "c", "b"), ids(merged));
        assertEquals((0.4 + 0.15) * 1.1, merged.get(0).getScore(), EPS);
        assertEquals(0.3 * 1.1, merged.get(1).getScore(), EPS);
        assertEquals(0.15 * 1.1, merged.get(2).getScore(), EPS);
    }

    @Test
    void merge_shouldKeepUnionOrderForTies() {
        TravelUser user = user("u1", 30);
        RecommendableItem a = item("a", "park", null, null);
        RecommendableItem b = item("b", "park", null, null);

        List<ScoredItem> merged = engine.merge(user, Arrays.asList(b, a),
                Collections.emptyMap(), scores("a", 0.5, "b", 0.5), Collections.emptyMap());

        assertEquals(Arrays.asList("a", "b"), ids(merged));
    }

    private void stubColdStart(TravelUser user) {
        when(dataAccessor.getCandidateItems(DEST)).thenReturn(
                new CandidateItems(new ArrayList<>(Arrays.asList(club, park, zoo)), new ArrayList<>()));
        when(dataAccessor.getUserInteractions(user.getId())).thenReturn(Collections.<Interaction>emptyList());
        when(dataAccessor.getAllUsers()).thenReturn(Collections.singletonList(user));
    }

    private static Map<String, Double> scores(Object... pairs) {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], (Double) pairs[i + 1]);
        }
        return map;
    }

    private static List<String> ids(List<ScoredItem> items) {
        List<String> ids = new ArrayList<>();
        for (ScoredItem item : items) {
            ids.add(item.getItem().getId());
        }
        return ids;
    }

    private static TravelUser user(String id, Integer age) {
        TravelUser user = new TravelUser();
        user.setId(id);
        user.setAge(age);
        return user;
    }

    private static RecommendableItem item(String id, String category, String energy, String ageProfile) {
        ItemFeatures features = new ItemFeatures();
        features.setEnergyLevel(energy);
        features.setAgeSuitabilityProfile(ageProfile);
        return RecommendableItem.builder()
                .kind(ItemKind.PLACE)
                .id(id)
                .name(id)
                .category(category)
                .features(features)
                .location(DEST)
                .build();
    }
}
