package com.example.earnings.service;

import com.example.earnings.model.decomposition.AttributionScores;
import com.example.earnings.model.decomposition.ControlFlags;
import com.example.earnings.model.decomposition.DecompositionRow;
import com.example.earnings.model.decomposition.MetricValues;
import com.example.earnings.support.TestRecords;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 캐시가 켜진 컨텍스트에서 같은 입력의 결과 행은 공유되므로 값 객체가 불변이어야 한다.
 */
@SpringBootTest
class DecompositionCacheTest {

    @Autowired
    DecompositionService service;

    @Test
    @DisplayName("같은 입력 두 번: 두 번째는 캐시된 행을 그대로 돌려주고 값도 같다")
    void repeatedInputServedFromCache() {
        List<DecompositionRow> first = service.decompose(TestRecords.steadyQuarters("CACHED", 9, 10), null)
                .block(Duration.ofSeconds(10));
        List<DecompositionRow> second = service.decompose(TestRecords.steadyQuarters("CACHED", 9, 10), null)
                .block(Duration.ofSeconds(10));

        assertNotNull(first);
        assertNotNull(second);
        assertEquals(first.size(), second.size());
        for (int i = 0; i < first.size(); i++) {
            DecompositionRow a = first.get(i);
            DecompositionRow b = second.get(i);
            assertSame(a, b, "row " + i);
            assertEquals(a.getReported(), b.getReported());
            assertEquals(a.getScores(), b.getScores());
        }
        DecompositionRow last = second.get(second.size() - 1);
        assertEquals(180.0, last.getReported().getPbt(), 1e-9);
    }

    @Test
    @DisplayName("행과 행이 담는 값 객체에는 공개 setter 가 없고 모든 필드가 final")
    void rowValueObjectsAreImmutable() {
        for (Class<?> type : List.of(DecompositionRow.class, MetricValues.class, AttributionScores.class, ControlFlags.class)) {
            for (Method m : type.getMethods()) {
                assertFalse(m.getName().startsWith("set"), type.getSimpleName() + "." + m.getName());
            }
            for (Field f : type.getDeclaredFields()) {
                if (f.isSynthetic()) continue;
                assertTrue(Modifier.isFinal(f.getModifiers()), type.getSimpleName() + "." + f.getName());
            }
        }
    }
}
