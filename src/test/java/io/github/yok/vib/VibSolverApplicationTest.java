package io.github.yok.vib;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.vib.app.VibProperties;
import io.github.yok.vib.core.matrix.PerturbationMatrixBuilder;
import io.github.yok.vib.core.matrix.TabulatedPerturbationMatrixBuilder;
import io.github.yok.vib.core.series.RsptSeriesGenerator;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

/**
 * テスト用の application.yml（サンプル分子、Emax=13000）で CLI 全体を実行します。
 */
@SpringBootTest
public class VibSolverApplicationTest {

    @Autowired
    private VibProperties properties;

    @Autowired
    private PerturbationMatrixBuilder builder;

    @Autowired
    private RsptSeriesGenerator seriesGenerator;

    @Test
    public void testPropertiesAreBound() {
        assertEquals(13000.0, properties.getBasis().getEnergyCutoff(), 0.0);
        assertEquals(VibProperties.Assembly.Method.TABULATED,
                properties.getAssembly().getMethod());
        assertEquals(2, properties.getAssembly().getParallelism());
        assertEquals(12, properties.getRspt().getOrder());
        assertNotNull(properties.getInput().getFrequencies());
        assertTrue(properties.getInput().getAnharmonicCoefficients().exists());

        assertTrue(builder instanceof TabulatedPerturbationMatrixBuilder);
        assertEquals(2, ((TabulatedPerturbationMatrixBuilder) builder).getParallelism());
        assertEquals(40, seriesGenerator.getPrecisionDigits());

        String echoed = properties.toMultilineString();
        assertTrue(echoed.contains("energyCutoff: 13000.0"));
        assertTrue(echoed.contains("precisionDigits: 40"));
    }

    @Test
    public void testCliRunWritesResults() {
        Path dir = Paths.get(properties.getOutput().getDir());
        assertTrue(Files.exists(dir.resolve("vib_zeroOrder_Emax=13000.00.txt")));
        assertTrue(Files.exists(dir.resolve("vib_variational_Emax=13000.00.txt")));
        assertTrue(Files.exists(dir.resolve("vib_rspt_q=0_Emax=13000.00.csv")));
        assertTrue(Files.exists(dir.resolve("vib_meta_Emax=13000.00.csv")));
    }
}
