package io.github.archlog;

import java.util.List;

/**
 * Ordered tags of a repository, newest first.
 *
 * @param tags tags in platform order
 */
public record TagIndex(List<TagInfo> tags) {

	public TagIndex {
		tags = List.copyOf(tags);
	}

	public boolean isEmpty() {
		return tags.isEmpty();
	}

	public int size() {
		return tags.size();
	}

	public List<String> names() {
		return tags.stream().map(TagInfo::name).toList();
	}

	public boolean contains(String tagName) {
		return indexOf(tagName) >= 0;
	}

	/**
	 * Returns the position of a tag.
	 * @param tagName tag to look for
	 * @return index, or -1 if absent
	 */
	public int indexOf(String tagName) {
		for (int i = 0; i < tags.size(); i++) {
			if (tags.get(i).name().equals(tagName)) {
				return i;
			}
		}
		return -1;
	}

}
