package dev.jbang.mediafetch.util;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileUtilsTest {

	@TempDir
	Path tempDir;

	@Test
	void testSanitizeFilename() {
		assertThat(FileUtils.sanitizeFilename("a<b>c:d\"e/f\\g|h?i*j")).isEqualTo("a_b_c_d_e_f_g_h_i_j");
		assertThat(FileUtils.sanitizeFilename("photo 1.jpg")).isEqualTo("photo 1.jpg");
		assertThat(FileUtils.sanitizeFilename("x".repeat(150))).hasSize(100);
	}

	@Test
	void testSanitizeDirectoryNames() {
		assertThat(FileUtils.sanitizeFilename(".")).isEqualTo("_");
		assertThat(FileUtils.sanitizeFilename("..")).isEqualTo("_");
		assertThat(FileUtils.sanitizeFilename("../etc")).isEqualTo(".._etc");
		assertThat(FileUtils.sanitizeFilename("...")).isEqualTo("...");
	}

	@Test
	void testEnsureDirectory() throws Exception {
		// Given
		Path dir = tempDir.resolve("a").resolve("b");

		// When
		FileUtils.ensureDirectory(dir);
		FileUtils.ensureDirectory(dir);

		// Then
		assertThat(dir).isDirectory();
	}

	@Test
	void testPartialAndEmptyFiles() throws Exception {
		// Given
		Path part = Files.writeString(tempDir.resolve("a.jpg.part"), "xx");
		Path empty = Files.createFile(tempDir.resolve("b.jpg"));
		Path full = Files.writeString(tempDir.resolve("c.jpg"), "data");

		// Then
		assertThat(FileUtils.isPartialFile(part)).isTrue();
		assertThat(FileUtils.isPartialFile(full)).isFalse();
		assertThat(FileUtils.isEmptyFile(empty)).isTrue();
		assertThat(FileUtils.isEmptyFile(full)).isFalse();
		assertThat(FileUtils.isEmptyFile(tempDir.resolve("missing"))).isFalse();
	}
}
