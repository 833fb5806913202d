package io.evitadb.scriptorium.chunk;

import io.evitadb.scriptorium.model.Chunk;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Splits documents into ordered chunks sized for a single generation call.
 *
 * The algorithm:
 * 1. Segment the document into structural units. A unit starts at a non-blank line following blank
 *    lines (paragraph break) or at an ATX heading line. Fenced code blocks are never split inside.
 * 2. Pack units greedily into chunks that do not exceed the maximum size.
 * 3. When a chunk has to be closed, back up to the highest-level heading inside it as long as the
 *    chunk keeps at least 80% of the maximum size (H1 is preferred over H2 and so on).
 * 4. A unit larger than the maximum is hard-split at the last line break, sentence end or
 *    whitespace before the limit.
 *
 * No chunk is ever longer than the maximum. A run of blank lines longer than the maximum therefore
 * yields chunks that contain only whitespace; the stages pass those through unchanged.
 *
 * Whitespace is never dropped: it stays attached to the chunk it follows, so concatenating the
 * source text of all chunks in index order reproduces the document exactly.
 */
public class Chunker {

	/**
	 * Default maximum chunk size in characters.
	 */
	public static final int DEFAULT_MAX_CHUNK_SIZE = 2000;

	/**
	 * Size tolerance as a fraction (20%) used when backing up to a heading.
	 */
	public static final double SIZE_TOLERANCE = 0.2;

	/**
	 * Pattern to match ATX-style headings (# Heading, ## Heading, etc.)
	 */
	private static final Pattern HEADING_PATTERN = Pattern.compile("^(#{1,6})\\s+\\S.*$");

	private final int maxChunkSize;
	private final int minPreferredSize;

	/**
	 * Creates a Chunker with the default maximum chunk size.
	 */
	public Chunker() {
		this(DEFAULT_MAX_CHUNK_SIZE);
	}

	/**
	 * Creates a Chunker with a custom maximum chunk size.
	 *
	 * @param maxChunkSize maximum chunk size in characters
	 */
	public Chunker(int maxChunkSize) {
		if (maxChunkSize <= 0) {
			throw new IllegalArgumentException("maxChunkSize must be positive");
		}
		this.maxChunkSize = maxChunkSize;
		this.minPreferredSize = (int) (maxChunkSize * (1 - SIZE_TOLERANCE));
	}

	/**
	 * Returns the configured maximum chunk size.
	 */
	public int getMaxChunkSize() {
		return this.maxChunkSize;
	}

	/**
	 * Splits the document into chunks.
	 *
	 * @param document the full document text
	 * @return chunks ordered by index, never empty
	 * @throws ChunkingException if the document is empty or contains only whitespace
	 */
	@Nonnull
	public List<Chunk> split(@Nonnull String document) throws ChunkingException {
		Objects.requireNonNull(document, "document must not be null");
		if (document.isBlank()) {
			throw new ChunkingException("Document is empty", document.length());
		}

		if (document.length() <= this.maxChunkSize) {
			return List.of(Chunk.of(0, document));
		}

		final List<Unit> units = segment(document);
		final List<int[]> ranges = pack(document, units);

		final List<Chunk> chunks = new ArrayList<>(ranges.size());
		for (int[] range : ranges) {
			chunks.add(Chunk.of(chunks.size(), document.substring(range[0], range[1])));
		}
		return chunks;
	}

	/**
	 * Splits the document with an explicit maximum chunk size.
	 *
	 * @param document     the full document text
	 * @param maxChunkSize maximum chunk size in characters
	 * @return chunks ordered by index
	 * @throws ChunkingException if the document is empty
	 */
	@Nonnull
	public static List<Chunk> split(@Nonnull String document, int maxChunkSize) throws ChunkingException {
		return new Chunker(maxChunkSize).split(document);
	}

	/**
	 * Cuts the document into structural units covering it without gaps.
	 *
	 * @param document the document
	 * @return units in document order
	 */
	@Nonnull
	private List<Unit> segment(@Nonnull String document) {
		final List<Unit> units = new ArrayList<>();
		final int length = document.length();
		int position = 0;
		int unitStart = 0;
		int unitHeading = 0;
		boolean unitHasContent = false;
		boolean previousBlank = false;
		String openFence = null;

		while (position < length) {
			final int newline = document.indexOf('\n', position);
			final int lineEnd = newline < 0 ? length : newline + 1;
			final String line = document.substring(position, lineEnd);
			final String trimmed = line.strip();
			final boolean blank = trimmed.isEmpty();

			if (openFence == null && !blank) {
				final int headingLevel = headingLevel(line);
				if (unitHasContent && (previousBlank || headingLevel > 0)) {
					units.add(new Unit(unitStart, position, unitHeading));
					unitStart = position;
					unitHeading = headingLevel;
				} else if (!unitHasContent) {
					unitHeading = headingLevel;
				}
			}
			if (!blank) {
				unitHasContent = true;
			}

			if (trimmed.startsWith("```") || trimmed.startsWith("~~~")) {
				final String marker = trimmed.substring(0, 3);
				if (openFence == null) {
					openFence = marker;
				} else if (openFence.equals(marker)) {
					openFence = null;
				}
			}

			previousBlank = blank && openFence == null;
			position = lineEnd;
		}
		units.add(new Unit(unitStart, length, unitHeading));
		return units;
	}

	/**
	 * Packs units into chunk ranges.
	 *
	 * @param document the document
	 * @param units    structural units in order
	 * @return list of [start, end) ranges covering the document
	 */
	@Nonnull
	private List<int[]> pack(@Nonnull String document, @Nonnull List<Unit> units) {
		final List<int[]> ranges = new ArrayList<>();
		final List<Unit> current = new ArrayList<>();

		for (Unit unit : units) {
			if (unit.length() > this.maxChunkSize) {
				if (!current.isEmpty()) {
					ranges.add(new int[]{current.get(0).start(), current.get(current.size() - 1).end()});
					current.clear();
				}
				// the last piece stays open so that following small units can join it
				current.add(hardSplit(document, unit, ranges));
				continue;
			}

			if (!current.isEmpty() && unit.end() - current.get(0).start() > this.maxChunkSize) {
				final int cut = preferredCut(current);
				ranges.add(new int[]{current.get(0).start(), current.get(cut - 1).end()});
				final List<Unit> carried = new ArrayList<>(current.subList(cut, current.size()));
				current.clear();
				current.addAll(carried);
				if (!current.isEmpty() && unit.end() - current.get(0).start() > this.maxChunkSize) {
					ranges.add(new int[]{current.get(0).start(), current.get(current.size() - 1).end()});
					current.clear();
				}
			}
			current.add(unit);
		}

		if (!current.isEmpty()) {
			ranges.add(new int[]{current.get(0).start(), current.get(current.size() - 1).end()});
		}
		return ranges;
	}

	/**
	 * Picks the number of units to keep in the chunk being closed. Prefers cutting before the
	 * highest-level heading (and the latest one among equals) if the chunk stays within tolerance,
	 * otherwise keeps all units.
	 *
	 * @param current units of the chunk being closed
	 * @return number of units that form the closed chunk (at least 1)
	 */
	private int preferredCut(@Nonnull List<Unit> current) {
		final int chunkStart = current.get(0).start();
		int bestCut = current.size();
		int bestLevel = Integer.MAX_VALUE;
		for (int i = 1; i < current.size(); i++) {
			final Unit candidate = current.get(i);
			if (candidate.headingLevel() > 0
				&& candidate.start() - chunkStart >= this.minPreferredSize
				&& candidate.headingLevel() <= bestLevel) {
				bestLevel = candidate.headingLevel();
				bestCut = i;
			}
		}
		return bestCut;
	}

	/**
	 * Splits an oversized unit. All pieces but the last are appended to the ranges; the last piece is
	 * returned so that the caller can continue packing after it. Trailing whitespace counts towards the
	 * limit: a whitespace run longer than the limit continues in the next piece.
	 *
	 * @param document the document
	 * @param unit     unit to split
	 * @param ranges   ranges collected so far
	 * @return the trailing piece as a unit, never longer than the maximum chunk size
	 */
	@Nonnull
	private Unit hardSplit(@Nonnull String document, @Nonnull Unit unit, @Nonnull List<int[]> ranges) {
		int position = unit.start();
		boolean first = true;
		while (unit.end() - position > this.maxChunkSize) {
			final int cut = findCut(document, position, position + this.maxChunkSize);
			ranges.add(new int[]{position, cut});
			position = cut;
			first = false;
		}
		return new Unit(position, unit.end(), first ? unit.headingLevel() : 0);
	}

	/**
	 * Finds the split position within (start, limit]: after the last line break, sentence end or
	 * whitespace, in this order of preference, or exactly at the limit.
	 */
	private int findCut(@Nonnull String document, int start, int limit) {
		final int half = start + this.maxChunkSize / 2;

		for (int i = limit - 1; i >= half; i--) {
			if (document.charAt(i) == '\n') {
				return i + 1;
			}
		}
		for (int i = limit - 2; i >= half; i--) {
			final char c = document.charAt(i);
			if ((c == '.' || c == '!' || c == '?') && Character.isWhitespace(document.charAt(i + 1))) {
				return i + 2;
			}
		}
		for (int i = limit - 1; i > start; i--) {
			if (Character.isWhitespace(document.charAt(i))) {
				return i + 1;
			}
		}
		if (limit - 1 > start && Character.isHighSurrogate(document.charAt(limit - 1))) {
			return limit - 1;
		}
		return limit;
	}

	/**
	 * Returns the ATX heading level of the line, or 0 if the line is not a heading.
	 */
	private static int headingLevel(@Nonnull String line) {
		final String content = line.stripTrailing();
		if (!HEADING_PATTERN.matcher(content).matches()) {
			return 0;
		}
		int level = 0;
		while (level < content.length() && content.charAt(level) == '#') {
			level++;
		}
		return level;
	}

	/**
	 * A structural unit: [start, end) range of the document.
	 *
	 * @param start        start offset (inclusive)
	 * @param end          end offset (exclusive)
	 * @param headingLevel heading level of the first line, 0 if not a heading
	 */
	private record Unit(int start, int end, int headingLevel) {
		int length() {
			return this.end - this.start;
		}
	}
}
