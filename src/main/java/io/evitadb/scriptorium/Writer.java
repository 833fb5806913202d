package io.evitadb.scriptorium;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writer outputs an assembled translation to a target file.
 */
public final class Writer {

	/**
	 * Writes the document to the target file in UTF-8, creating missing parent directories.
	 * The document is written exactly as assembled, without any trailing newline being added.
	 *
	 * @param document   the translated document
	 * @param targetFile the file to write
	 * @throws IOException if an I/O error occurs while creating directories or writing the file
	 */
	public void write(
		@Nonnull final String document,
		@Nonnull final Path targetFile
	) throws IOException {
		Objects.requireNonNull(document, "document must not be null");
		Objects.requireNonNull(targetFile, "targetFile must not be null");

		final Path absolute = targetFile.toAbsolutePath().normalize();
		final Path parent = absolute.getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Files.write(absolute, document.getBytes(StandardCharsets.UTF_8));
	}

	/**
	 * Derives the default output path: the language code is inserted before the extension,
	 * `guide.md` becomes `guide.de.md`.
	 *
	 * @param sourceFile     the translated source file
	 * @param targetLanguage language of the translation
	 * @return path next to the source file
	 */
	@Nonnull
	public static Path defaultTarget(@Nonnull final Path sourceFile, @Nonnull final String targetLanguage) {
		final String fileName = sourceFile.getFileName().toString();
		final String suffix = targetLanguage.strip().toLowerCase().replaceAll("[^a-z0-9_-]+", "-");
		final int dot = fileName.lastIndexOf('.');
		final String targetName = dot > 0
			? fileName.substring(0, dot) + "." + suffix + fileName.substring(dot)
			: fileName + "." + suffix;
		return sourceFile.resolveSibling(targetName);
	}
}
