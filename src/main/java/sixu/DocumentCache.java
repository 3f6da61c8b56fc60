package sixu;

import sixu.cst.CstRoot;
import sixu.parse.CstParser;

import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;

/**
 * Latest complete CST per open document.
 *
 * Parsing happens outside the map; publishing is an atomic
 * compare-by-version, so a slow parse of an older version never replaces the
 * tree of a newer one. Readers always see a whole tree.
 */
public final class DocumentCache {
	private static final Logger LOGGER = Logger.getLogger(DocumentCache.class.getName());

	private record Entry(long version, CstRoot root) {
	}

	private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
	private final CstParser parser;

	public DocumentCache() {
		this(new CstParser());
	}

	public DocumentCache(CstParser parser) {
		this.parser = parser;
	}

	/**
	 * Parses {@code text} as {@code version} of the document and publishes it
	 * unless a newer version is already cached.
	 *
	 * @return the tree current for the document after the call
	 */
	public CstRoot update(String uri, long version, String text) {
		Entry fresh = new Entry(version, parser.parse(uri, text));
		Entry current = entries.merge(uri, fresh,
				(old, candidate) -> candidate.version() >= old.version() ? candidate : old);
		if (current != fresh) {
			LOGGER.fine(() -> "Discarded parse of " + uri + " v" + version + "; v" + current.version() + " is newer");
		} else {
			LOGGER.fine(() -> "Cached " + uri + " v" + version);
		}
		return current.root();
	}

	public Optional<CstRoot> get(String uri) {
		Entry entry = entries.get(uri);
		return entry == null ? Optional.empty() : Optional.of(entry.root());
	}

	public OptionalLong version(String uri) {
		Entry entry = entries.get(uri);
		return entry == null ? OptionalLong.empty() : OptionalLong.of(entry.version());
	}

	public void close(String uri) {
		if (entries.remove(uri) != null) {
			LOGGER.fine(() -> "Evicted " + uri);
		}
	}

	public int size() {
		return entries.size();
	}
}
