package org.springaicommunity.github.triage;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Set;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	public @Nullable String command;

	// Collection identity
	public @Nullable String repository;

	public @Nullable String prefix;

	// Pull options
	public Set<ItemType> itemTypes = EnumSet.allOf(ItemType.class);

	public boolean force = false;

	public @Nullable LocalDate startDate = null; // null keeps the stored start date

	// Validate options
	public boolean deleteInvalid = false;

	// Overrides of TriageProperties
	public String dataDirectory;

	public int windowDays;

	public int embeddingWorkers;

	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(TriageProperties defaultProperties) {
		this.dataDirectory = defaultProperties.getDataDirectory();
		this.windowDays = defaultProperties.getWindowDays();
		this.embeddingWorkers = defaultProperties.getEmbeddingWorkers();
		this.verbose = defaultProperties.isDebug();
	}

	/**
	 * The collection key named by the repository and prefix options.
	 * @throws IllegalStateException if no repository was given
	 */
	public CollectionKey collectionKey() {
		if (repository == null) {
			throw new IllegalStateException("No repository configured");
		}
		return new CollectionKey(repository, prefix);
	}

	/**
	 * Copy the command-line overrides onto a properties instance.
	 * @param properties the properties to update
	 * @return the same properties
	 */
	public TriageProperties applyTo(TriageProperties properties) {
		properties.setDataDirectory(dataDirectory);
		properties.setWindowDays(windowDays);
		properties.setEmbeddingWorkers(embeddingWorkers);
		properties.setDebug(verbose);
		if (startDate != null) {
			properties.setStartDate(startDate);
		}
		return properties;
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "command='" + command + '\'' + ", repository='" + repository + '\''
				+ ", prefix='" + prefix + '\'' + ", itemTypes=" + itemTypes + ", force=" + force + ", startDate="
				+ startDate + ", deleteInvalid=" + deleteInvalid + ", dataDirectory='" + dataDirectory + '\''
				+ ", windowDays=" + windowDays + ", embeddingWorkers=" + embeddingWorkers + ", verbose=" + verbose
				+ ", helpRequested=" + helpRequested + '}';
	}

}
