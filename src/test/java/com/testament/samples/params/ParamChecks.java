package com.testament.samples.params;

import com.testament.api.Module;
import com.testament.api.Parameterize;
import com.testament.api.RunMode;
import org.slf4j.Logger;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

@Module(runMode = RunMode.SEQUENTIAL)
public class ParamChecks {

    public static Object[][] sums() {
        return new Object[][]{
                {1, 1, 2},
                {2, 3, 5},
                {10, -4, 6},
                {0, 0, 1},
                {7, 8, 15}
        };
    }

    public List<Object[]> labelledSums() {
        return List.of(
                new Object[]{"small", 1, 2, 3},
                new Object[]{"large", 100, 200, 300});
    }

    public static List<String> words() {
        return List.of("alpha", "beta", "gamma");
    }

    @Parameterize("sums")
    public void testAdd(int a, int b, int expected, Logger logger) {
        logger.debug("{} + {}", a, b);
        assertEquals(expected, a + b);
    }

    @Parameterize(value = "labelledSums", firstArgIsName = true)
    public void testLabelled(int a, int b, int expected) {
        assertEquals(expected, a + b);
    }

    @Parameterize("words")
    public void testWord(String word) {
        assertEquals(word.toLowerCase(), word);
    }
}
