package dev.jbang.mediafetch.util;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import dev.jbang.mediafetch.governor.DownloadTask;
import dev.jbang.mediafetch.model.DownloadReportFile;
import dev.jbang.mediafetch.model.ManifestEntry;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reading download manifests and writing download reports */
public class ManifestUtils {
	private static final ObjectMapper readMapper =
			new ObjectMapper().configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);

	private static final ObjectMapper writeMapper = JsonMapper.builder()
			.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
			.enable(SerializationFeature.INDENT_OUTPUT)
			.build();

	private static final String DEFAULT_EXTENSION = ".bin";

	/**
	 * Open a manifest for lazy reading. The file must contain a JSON array of entries (or a sequence
	 * of root-level entry objects); entries are parsed one at a time as the iterator advances. The
	 * caller must close the iterator.
	 */
	public static MappingIterator<ManifestEntry> readManifest(Path manifestFile) throws IOException {
		return readMapper.readerFor(ManifestEntry.class).readValues(manifestFile.toFile());
	}

	/** Check that an entry has what is needed to download it */
	public static boolean isValidEntry(ManifestEntry entry) {
		return entry != null
				&& entry.id() != null
				&& !entry.id().isBlank()
				&& entry.url() != null
				&& !entry.url().isBlank();
	}

	public static DownloadTask toTask(ManifestEntry entry, Path outputDir) {
		return new DownloadTask(entry.id(), entry.url(), outputDir.resolve(filenameFor(entry)));
	}

	/**
	 * Determine the local file name of an entry: its own filename if given, otherwise {@code
	 * msg_<id>} with the extension of the URL path.
	 */
	public static String filenameFor(ManifestEntry entry) {
		if (entry.filename() != null && !entry.filename().isBlank()) {
			return FileUtils.sanitizeFilename(entry.filename());
		}
		return FileUtils.sanitizeFilename("msg_" + entry.id()) + extensionOf(entry.url());
	}

	static String extensionOf(String url) {
		try {
			String path = URI.create(url).getPath();
			if (path != null) {
				String name = path.substring(path.lastIndexOf('/') + 1);
				int dot = name.lastIndexOf('.');
				if (dot > 0 && dot < name.length() - 1) {
					return FileUtils.sanitizeFilename(name.substring(dot));
				}
			}
		} catch (IllegalArgumentException e) {
			// Not a URI, fall back to the default
		}
		return DEFAULT_EXTENSION;
	}

	public static void saveReport(Path reportFile, DownloadReportFile report) throws IOException {
		Path parent = reportFile.toAbsolutePath().getParent();
		if (parent != null) {
			FileUtils.ensureDirectory(parent);
		}
		try (var writer = Files.newBufferedWriter(reportFile)) {
			writeMapper.writeValue(writer, report);
			writer.write("\n");
		}
	}

	public static DownloadReportFile readReport(Path reportFile) throws IOException {
		return readMapper.readValue(reportFile.toFile(), DownloadReportFile.class);
	}
}
