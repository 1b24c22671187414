package io.github.yok.vib.out;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.vib.core.basis.ZeroOrderStateEnumerator;
import io.github.yok.vib.core.harmonic.HarmonicWeightTableCache;
import io.github.yok.vib.core.linearalgebra.EjmlSymmetricEigenDecompositionBackend;
import io.github.yok.vib.core.matrix.TabulatedPerturbationMatrixBuilder;
import io.github.yok.vib.core.potential.AnharmonicPotential;
import io.github.yok.vib.core.potential.AnharmonicTerm;
import io.github.yok.vib.core.series.RsptSeriesGenerator;
import io.github.yok.vib.core.solver.CalculationRequest;
import io.github.yok.vib.core.solver.CalculationResult;
import io.github.yok.vib.core.solver.VariationalSolver;
import io.github.yok.vib.core.solver.VibrationalCalculator;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class FileResultWriterTest {

    @TempDir
    Path tempDir;

    private static CalculationResult calculate(boolean rspt) {
        VibrationalCalculator calculator = new VibrationalCalculator(new ZeroOrderStateEnumerator(),
                new TabulatedPerturbationMatrixBuilder(new HarmonicWeightTableCache(), 1),
                new VariationalSolver(new EjmlSymmetricEigenDecompositionBackend()),
                new RsptSeriesGenerator());
        AnharmonicPotential potential = new AnharmonicPotential(2,
                List.of(AnharmonicTerm.of(-0.1, 3, 0), AnharmonicTerm.of(0.05, 1, 2)));
        return calculator.calculate(CalculationRequest.builder()
                .frequencies(new double[] {1.0, 1.6}).potential(potential).energyCutoff(6.0)
                .rsptEnabled(rspt).rsptOrder(5).build());
    }

    @Test
    public void testFormatRowIsFixedWidth() {
        String row = FileResultWriter.formatRow(new int[] {1, 12, 0}, 4077.15);
        assertEquals(3 * 4 + 24, row.length());
        assertEquals("   1  12   0   4077.1500000000000000", row);
    }

    @Test
    public void testWritesAllFiles() throws IOException {
        CalculationResult result = calculate(true);
        new FileResultWriter(tempDir.toString()).write(result, 6.0);

        Path zeroOrder = tempDir.resolve("vib_zeroOrder_Emax=6.00.txt");
        Path variational = tempDir.resolve("vib_variational_Emax=6.00.txt");
        Path rspt = tempDir.resolve("vib_rspt_q=0_Emax=6.00.csv");
        Path meta = tempDir.resolve("vib_meta_Emax=6.00.csv");
        assertTrue(Files.exists(zeroOrder));
        assertTrue(Files.exists(variational));
        assertTrue(Files.exists(rspt));
        assertTrue(Files.exists(meta));

        int n = result.getBasis().size();
        List<String> rows = Files.readAllLines(zeroOrder, StandardCharsets.UTF_8);
        assertEquals(n, rows.size());
        assertEquals(FileResultWriter.formatRow(result.getBasis().get(0).quantumNumbers(),
                result.getBasis().get(0).getEnergy()), rows.get(0));
        for (String row : rows) {
            assertEquals(2 * 4 + 24, row.length());
        }
        assertEquals(n, Files.readAllLines(variational, StandardCharsets.UTF_8).size());

        try (Reader r = Files.newBufferedReader(rspt, StandardCharsets.UTF_8);
                CSVParser parser = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader().setSkipHeaderRecord(true).build().parse(r)) {
            List<CSVRecord> records = parser.getRecords();
            assertEquals(5, records.size());
            assertEquals("0", records.get(0).get("order"));
            double e0 = Double.parseDouble(records.get(0).get("coefficient"));
            double s0 = Double.parseDouble(records.get(0).get("partialSum"));
            assertEquals(result.getSeries().getZeroOrderEnergy() + e0, s0, 1e-12);
        }

        try (Reader r = Files.newBufferedReader(meta, StandardCharsets.UTF_8);
                CSVParser parser = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader().setSkipHeaderRecord(true).build().parse(r)) {
            boolean found = false;
            for (CSVRecord record : parser) {
                if ("basisSize".equals(record.get("key"))) {
                    assertEquals(String.valueOf(n), record.get("value"));
                    found = true;
                }
            }
            assertTrue(found);
        }
    }

    @Test
    public void testSkipsSeriesFileWhenDisabled() {
        new FileResultWriter(tempDir.toString()).write(calculate(false), 6.0);
        assertFalse(Files.exists(tempDir.resolve("vib_rspt_q=0_Emax=6.00.csv")));
        assertTrue(Files.exists(tempDir.resolve("vib_meta_Emax=6.00.csv")));
    }

    @Test
    public void testRejectsInvalidArguments() throws IOException {
        assertThrows(IllegalArgumentException.class, () -> new FileResultWriter(""));
        FileResultWriter writer = new FileResultWriter(tempDir.toString());
        assertThrows(IllegalArgumentException.class, () -> writer.write(null, 1.0));

        // 出力先がファイルの場合は書き込めません。
        Path blocker = Files.createFile(tempDir.resolve("blocker"));
        FileResultWriter blocked = new FileResultWriter(blocker.resolve("sub").toString());
        assertThrows(IllegalStateException.class, () -> blocked.write(calculate(false), 6.0));
    }
}
