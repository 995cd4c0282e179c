package io.github.archlog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes collected changelogs as one JSON document.
 *
 * <p>
 * Entries of a package are grouped by version tag in first-seen order. Packaging entries
 * ({@code minor}, {@code arch}) go to {@code changelog Arch package}, upstream entries
 * ({@code major}) to {@code changelog origin package}.
 */
public class ChangelogWriter {

	private static final Logger logger = LoggerFactory.getLogger(ChangelogWriter.class);

	static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmm");

	static final String FILE_SUFFIX = "-changelog.json";

	static final String NOT_APPLICABLE = "- Not applicable, minor release -";

	static final String ORIGIN_MISSING = "- ERROR: Couldn't find origin changelog. Check the logs for further information -";

	private final ObjectMapper objectMapper;

	private final Clock clock;

	public ChangelogWriter(ObjectMapper objectMapper) {
		this(objectMapper, Clock.systemDefaultZone());
	}

	public ChangelogWriter(ObjectMapper objectMapper, Clock clock) {
		this.objectMapper = objectMapper;
		this.clock = clock;
	}

	/**
	 * Write the changelogs into a timestamped file of a directory. A file of the same
	 * minute is replaced.
	 * @param directory changelog directory, created if missing
	 * @param changelogs changelogs to write
	 * @return the written file
	 */
	public Path writeToDirectory(Path directory, List<PackageChangelog> changelogs) {
		Path file = directory.resolve(LocalDateTime.now(clock).format(FILE_TIMESTAMP) + FILE_SUFFIX);
		write(file, changelogs);
		return file;
	}

	/**
	 * Write the changelogs to a file.
	 * @param file target file, replaced if present
	 * @param changelogs changelogs to write
	 * @throws UncheckedIOException if the file cannot be written
	 */
	public void write(Path file, List<PackageChangelog> changelogs) {
		try {
			Path parent = file.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), toDocument(changelogs));
			logger.info("Changelog written to {}", file);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to write changelog " + file, e);
		}
	}

	ObjectNode toDocument(List<PackageChangelog> changelogs) {
		ObjectNode document = objectMapper.createObjectNode();
		ArrayNode packages = document.putArray("packages");
		ObjectNode changelog = document.putObject("changelog");

		for (PackageChangelog pkg : changelogs) {
			packages.add(pkg.name());
			ObjectNode node = changelog.putObject(pkg.name());
			node.put("description", pkg.description());
			node.put("base package", pkg.base() != null && !pkg.base().isBlank() ? pkg.base() : "-");
			node.put("current version", pkg.currentVersion());
			node.put("new version", pkg.newVersion());
			ArrayNode versions = node.putArray("versions");
			groupVersions(pkg).values().forEach(versions::add);
		}
		return document;
	}

	private Map<String, ObjectNode> groupVersions(PackageChangelog pkg) {
		Map<String, ObjectNode> groups = new LinkedHashMap<>();
		List<ChangelogEntry> entries = pkg.entries();

		if (entries.isEmpty()) {
			groups.put(pkg.currentVersion(), versionNode(pkg.currentVersion(), ReleaseType.UNKNOWN.value(), "", ""));
			return groups;
		}

		boolean hasOrigin = entries.stream().anyMatch(entry -> entry.releaseType() == ReleaseType.MAJOR);
		for (ChangelogEntry entry : entries) {
			ObjectNode group = groups.get(entry.versionTag());
			if (group == null) {
				group = newGroup(entry, entries, hasOrigin);
				groups.put(entry.versionTag(), group);
			}
			String list = entry.releaseType() == ReleaseType.MAJOR ? "changelog origin package"
					: "changelog Arch package";
			ObjectNode commit = ((ArrayNode) group.path("changelog").path(list)).addObject();
			commit.put("commit message", entry.message());
			commit.put("commit URL", entry.url());
		}
		return groups;
	}

	private ObjectNode newGroup(ChangelogEntry first, List<ChangelogEntry> entries, boolean hasOrigin) {
		String archUrl = "";
		String originUrl = "";
		for (ChangelogEntry entry : entries) {
			if (!entry.versionTag().equals(first.versionTag())) {
				continue;
			}
			if (entry.releaseType().isPackagingSide() && archUrl.isEmpty()
					&& entry.compareUrl().contains("archlinux.org")) {
				archUrl = entry.compareUrl();
			}
			else if (entry.releaseType() == ReleaseType.MAJOR && originUrl.isEmpty()) {
				originUrl = entry.compareUrl();
			}
		}

		ReleaseType type = first.releaseType();
		String releaseType = type == ReleaseType.ARCH ? ReleaseType.MAJOR.value() : type.value();
		if (type == ReleaseType.MINOR) {
			ObjectNode group = versionNode(first.versionTag(), releaseType, archUrl, NOT_APPLICABLE);
			originList(group).add(NOT_APPLICABLE);
			return group;
		}
		ObjectNode group = versionNode(first.versionTag(), releaseType, archUrl, originUrl);
		if (!hasOrigin) {
			originList(group).add(ORIGIN_MISSING);
		}
		return group;
	}

	private ObjectNode versionNode(String versionTag, String releaseType, String archUrl, String originUrl) {
		ObjectNode node = objectMapper.createObjectNode();
		node.put("version-tag", versionTag);
		node.put("release-type", releaseType);
		node.put("compare-url-tags-arch", archUrl);
		node.put("compare-url-tags-origin", originUrl);
		ObjectNode changelog = node.putObject("changelog");
		changelog.putArray("changelog Arch package");
		changelog.putArray("changelog origin package");
		return node;
	}

	private static ArrayNode originList(ObjectNode group) {
		return (ArrayNode) group.path("changelog").path("changelog origin package");
	}

}
