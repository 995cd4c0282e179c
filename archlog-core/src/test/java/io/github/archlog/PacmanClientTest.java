package io.github.archlog;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("PacmanClient Tests")
@ExtendWith(MockitoExtension.class)
class PacmanClientTest {

	@Mock
	private CommandRunner mockRunner;

	@Nested
	@DisplayName("Upgrade Listing Tests")
	class UpgradeListingTest {

		@Test
		@DisplayName("Should parse checkupdates output and skip malformed lines")
		void shouldParseUpgrades() {
			when(mockRunner.run(List.of("checkupdates"))).thenReturn(new CommandRunner.CommandResult(0,
					"linux 6.8.1.arch1-1 -> 6.8.2.arch1-1\nbroken line\nmesa 1:24.0.3-1 -> 1:24.0.4-1\n", ""));

			List<UpgradeCandidate> upgrades = new PacmanClient(mockRunner, "Architecture").listUpgradable();

			assertThat(upgrades).containsExactly(new UpgradeCandidate("linux", "6.8.1.arch1-1", "6.8.2.arch1-1"),
					new UpgradeCandidate("mesa", "1:24.0.3-1", "1:24.0.4-1"));
		}

		@Test
		@DisplayName("Should treat exit code 2 as no upgrades")
		void shouldHandleNoUpgrades() {
			when(mockRunner.run(List.of("checkupdates"))).thenReturn(new CommandRunner.CommandResult(2, "", ""));

			assertThat(new PacmanClient(mockRunner, "Architecture").listUpgradable()).isEmpty();
		}

		@Test
		@DisplayName("Should fail on other exit codes")
		void shouldFailOnError() {
			when(mockRunner.run(List.of("checkupdates")))
				.thenReturn(new CommandRunner.CommandResult(1, "", "Cannot fetch updates"));

			assertThatThrownBy(() -> new PacmanClient(mockRunner, "Architecture").listUpgradable())
				.isInstanceOf(PackageManagerException.class)
				.hasMessageContaining("Cannot fetch updates");
		}

	}

	@Nested
	@DisplayName("Architecture Tests")
	class ArchitectureLookupTest {

		@Test
		@DisplayName("Should read architecture with configured wording")
		void shouldReadArchitecture() {
			when(mockRunner.run(List.of("pacman", "-Q", "--info", "linux"))).thenReturn(new CommandRunner.CommandResult(
					0, "Name            : linux\nArchitektur     : x86_64\nURL             : https://kernel.org\n", ""));

			assertThat(new PacmanClient(mockRunner, "Architektur").getArchitecture("linux")).contains("x86_64");
		}

		@Test
		@DisplayName("Should return empty when wording does not match")
		void shouldReturnEmptyForOtherLanguage() {
			when(mockRunner.run(List.of("pacman", "-Q", "--info", "linux")))
				.thenReturn(new CommandRunner.CommandResult(0, "Architektur     : x86_64\n", ""));

			assertThat(new PacmanClient(mockRunner, "Architecture").getArchitecture("linux")).isEmpty();
		}

		@Test
		@DisplayName("Should return empty when package is not installed")
		void shouldReturnEmptyForMissingPackage() {
			when(mockRunner.run(List.of("pacman", "-Q", "--info", "foo")))
				.thenReturn(new CommandRunner.CommandResult(1, "", "error: package 'foo' was not found"));

			assertThat(new PacmanClient(mockRunner, "Architecture").getArchitecture("foo")).isEmpty();
		}

	}

}
