package com.reims.anomaly.controller;

import com.reims.anomaly.model.CacheStats;
import com.reims.anomaly.model.CachedModel;
import com.reims.anomaly.model.ModelScope;
import com.reims.anomaly.service.ModelCacheService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ModelCacheController.class)
class ModelCacheControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ModelCacheService modelCacheService;

    @Test
    void stats_returnsCounts() throws Exception {
        when(modelCacheService.getCacheStats()).thenReturn(CacheStats.builder()
                .totalModels(4).activeModels(3).expiredModels(1).totalUses(17).cacheEnabled(true)
                .build());

        mockMvc.perform(get("/api/v1/models/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalModels").value(4))
                .andExpect(jsonPath("$.activeModels").value(3))
                .andExpect(jsonPath("$.totalUses").value(17))
                .andExpect(jsonPath("$.cacheEnabled").value(true));
    }

    @Test
    void invalidate_byEntity() throws Exception {
        when(modelCacheService.invalidate(ModelScope.of("PROP-001", null), "lof")).thenReturn(2);

        mockMvc.perform(post("/api/v1/models/cache/invalidate")
                        .param("entityId", "PROP-001")
                        .param("modelType", "lof"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.invalidated").value(2));
    }

    @Test
    void invalidate_withoutParameters_matchesEverything() throws Exception {
        when(modelCacheService.invalidate(null, null)).thenReturn(5);

        mockMvc.perform(post("/api/v1/models/cache/invalidate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.invalidated").value(5));

        verify(modelCacheService).invalidate(isNull(), isNull());
    }

    @Test
    void get_found_omitsSerializedModel() throws Exception {
        CachedModel record = CachedModel.builder()
                .cacheKey("abc123")
                .scope(ModelScope.of("PROP-001", "operating_expenses"))
                .modelType("isolation_forest")
                .serializedModel(new byte[]{1, 2, 3})
                .createdAt(Instant.parse("2024-06-01T00:00:00Z"))
                .useCount(3)
                .active(true)
                .build();
        when(modelCacheService.find("abc123")).thenReturn(Optional.of(record));

        mockMvc.perform(get("/api/v1/models/cache/abc123"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cacheKey").value("abc123"))
                .andExpect(jsonPath("$.modelType").value("isolation_forest"))
                .andExpect(jsonPath("$.scope.entityId").value("PROP-001"))
                .andExpect(jsonPath("$.useCount").value(3))
                .andExpect(jsonPath("$.serializedModel").doesNotExist());
    }

    @Test
    void get_notFound_returns404() throws Exception {
        when(modelCacheService.find("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/models/cache/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("CACHED_MODEL_NOT_FOUND"))
                .andExpect(jsonPath("$.path").value("/api/v1/models/cache/missing"));
    }
}
