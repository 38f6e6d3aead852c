package dev.tessera.testrunner.index;

import com.fasterxml.jackson.dataformat.xml.XmlMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Reads and writes the gzip-compressed XML symbol index.
 */
public final class SymbolIndexFile {
	private SymbolIndexFile() {}

	private static final XmlMapper MAPPER = new XmlMapper();

	public static SymbolIndex read(Path path) throws SymbolIndexException {
		try(var stream = new GZIPInputStream(Files.newInputStream(path))) {
			var apis = MAPPER.readValue(stream, ApiIndex.class);
			return SymbolIndex.of(apis.getApis().stream().map(SymbolShape::fromEntry).toList());
		}
		catch(IOException | RuntimeException e) {
			throw new SymbolIndexException(path, e);
		}
	}

	public static void write(SymbolIndex index, Path path) throws IOException {
		var apis = new ApiIndex();
		apis.setApis(index.shapes().stream().map(SymbolShape::toEntry).toList());

		try(var stream = new GZIPOutputStream(Files.newOutputStream(path))) {
			MAPPER.writeValue(stream, apis);
		}
	}
}
