package com.safepocket.consensus.data;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.safepocket.consensus.model.Dataset;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvDatasetLoaderTest {

    private final CsvDatasetLoader loader = new CsvDatasetLoader();

    @Test
    void typesCellsAndDerivesNumericColumns() {
        String csv = """
                transaction_id,amount,quantity,merchant
                tx-1,12.50,3,Coffee
                tx-2,,4,Groceries
                tx-3,1e3,,"Laptop, Pro"
                """;

        Dataset dataset = loader.load(new StringReader(csv), "inline");

        assertThat(dataset.columns()).containsExactly("transaction_id", "amount", "quantity", "merchant");
        assertThat(dataset.numericColumns()).containsExactly("amount", "quantity");
        assertThat(dataset.value(0, "amount")).isEqualTo(12.5d);
        assertThat(dataset.value(0, "quantity")).isEqualTo(3L);
        assertThat(dataset.value(1, "amount")).isNull();
        assertThat(dataset.value(2, "amount")).isEqualTo(1000d);
        assertThat(dataset.value(2, "merchant")).isEqualTo("Laptop, Pro");
        assertThat(dataset.source()).isEqualTo("inline");
    }

    @Test
    void shortRecordsLeaveTrailingCellsMissing() {
        Dataset dataset = loader.load(new StringReader("a,b\n1,2\n3\n"), "inline");

        assertThat(dataset.rowCount()).isEqualTo(2);
        assertThat(dataset.value(1, "b")).isNull();
    }

    @Test
    void typedRecognisesLiterals() {
        assertThat(CsvDatasetLoader.typed(" -42 ")).isEqualTo(-42L);
        assertThat(CsvDatasetLoader.typed(".5")).isEqualTo(0.5d);
        assertThat(CsvDatasetLoader.typed("99999999999999999999")).isEqualTo(1e20d);
        assertThat(CsvDatasetLoader.typed("NaN")).isEqualTo("NaN");
        assertThat(CsvDatasetLoader.typed("12abc")).isEqualTo("12abc");
        assertThat(CsvDatasetLoader.typed("")).isNull();
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("data.csv");
        Files.writeString(file, "amount\n1\n2\n");

        Dataset dataset = loader.load(file);

        assertThat(dataset.rowCount()).isEqualTo(2);
        assertThat(dataset.source()).isEqualTo(file.toString());
    }

    @Test
    void missingFileIsADataLoadFailure(@TempDir Path dir) {
        assertThatThrownBy(() -> loader.load(dir.resolve("absent.csv")))
                .isInstanceOf(DataLoadException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void emptyInputIsADataLoadFailure() {
        assertThatThrownBy(() -> loader.load(new StringReader(""), "inline"))
                .isInstanceOf(DataLoadException.class);
    }

    @Test
    void duplicateHeaderIsADataLoadFailure() {
        assertThatThrownBy(() -> loader.load(new StringReader("a,a\n1,2\n"), "inline"))
                .isInstanceOf(DataLoadException.class);
    }
}
