package io.github.archlog.cli;

import io.github.archlog.UpgradeCandidate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PackageSelector Tests")
class PackageSelectorTest {

	private static final UpgradeCandidate LINUX = new UpgradeCandidate("linux", "6.8.1.arch1-1", "6.8.2.arch1-1");

	private static final UpgradeCandidate MESA = new UpgradeCandidate("mesa", "1:24.0.3-1", "1:24.0.4-1");

	private static final UpgradeCandidate FOO = new UpgradeCandidate("foo", "1.2.0-1", "1.3.0-1");

	private static final List<UpgradeCandidate> UPGRADES = List.of(LINUX, MESA, FOO);

	@Nested
	@DisplayName("Index Selection Tests")
	class IndexSelectionTest {

		@Test
		@DisplayName("Should select indices in table order")
		void shouldSelectIndices() {
			assertThat(PackageSelector.byIndices("3, 1", UPGRADES)).containsExactly(LINUX, FOO);
		}

		@Test
		@DisplayName("Should select everything for zero")
		void shouldSelectAllForZero() {
			assertThat(PackageSelector.byIndices("0", UPGRADES)).containsExactlyElementsOf(UPGRADES);
		}

		@Test
		@DisplayName("Should reject out of range index")
		void shouldRejectOutOfRange() {
			assertThatThrownBy(() -> PackageSelector.byIndices("4", UPGRADES))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("between 0 and 3");
		}

		@Test
		@DisplayName("Should reject non-numeric input")
		void shouldRejectNonNumeric() {
			assertThatThrownBy(() -> PackageSelector.byIndices("linux", UPGRADES))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("must be a number");
		}

		@Test
		@DisplayName("Should reject empty input")
		void shouldRejectEmptyInput() {
			assertThatThrownBy(() -> PackageSelector.byIndices(" , ", UPGRADES))
				.isInstanceOf(IllegalArgumentException.class);
		}

	}

	@Test
	@DisplayName("Should select by names and skip unknown ones")
	void shouldSelectByNames() {
		assertThat(PackageSelector.byNames(List.of("foo", "firefox", "linux"), UPGRADES)).containsExactly(FOO, LINUX);
	}

	@Test
	@DisplayName("Should align table columns")
	void shouldFormatTable() {
		String[] lines = PackageSelector.formatTable(UPGRADES).split(System.lineSeparator());

		assertThat(lines).hasSize(4);
		assertThat(lines[0]).startsWith("#  Package  Current");
		assertThat(lines[1]).isEqualTo("1  linux    6.8.1.arch1-1  6.8.2.arch1-1");
		assertThat(lines[2].indexOf("1:24.0.3-1")).isEqualTo(lines[1].indexOf("6.8.1.arch1-1"));
	}

}
