package org.springaicommunity.github.triage;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Pulls upstream changes into a collection, window by window.
 *
 * <p>
 * Each window is fetched, merged and written together with the advanced checkpoint in
 * one atomic save. A failure while fetching a window leaves both the collection and the
 * checkpoint as they were after the previous window, so the next pull resumes there.
 * Only complete windows advance the checkpoint. The trailing partial window ending at
 * the current time is merged but fetched again on the next pull, because GitHub's search
 * index lags recent writes and items updated just before "now" may be missing from it.
 * Re-reading the window costs one query per item type; a pull with no new upstream data
 * leaves both the records and the checkpoint unchanged and skips the save.
 */
public class IngestionService {

	private static final Logger logger = LoggerFactory.getLogger(IngestionService.class);

	private final SourceAdapter source;

	private final MergeEngine mergeEngine;

	private final CollectionStore store;

	private final FetchWindowPlanner planner;

	private final Clock clock;

	private final LocalDate defaultStartDate;

	public IngestionService(SourceAdapter source, MergeEngine mergeEngine, CollectionStore store,
			FetchWindowPlanner planner, Clock clock, LocalDate defaultStartDate) {
		this.source = source;
		this.mergeEngine = mergeEngine;
		this.store = store;
		this.planner = planner;
		this.clock = clock;
		this.defaultStartDate = defaultStartDate;
	}

	/**
	 * Fetch and merge everything updated since the stored checkpoints.
	 * @param request what to pull
	 * @return counters of the pull
	 * @throws SourceAuthenticationException if the credentials are rejected
	 * @throws SourceUnavailableException if a window cannot be fetched
	 */
	public PullResult pull(IngestionRequest request) {
		CollectionKey key = request.key();
		Counters counters = new Counters();
		try (CollectionLock lock = store.lock(key)) {
			IssueCollection collection = store.load(key);
			Instant now = clock.instant();
			logger.info("Pulling {} into {} ({} records){}", request.itemTypes(), key, collection.size(),
					request.forced() ? ", forced" : "");

			for (ItemType itemType : request.itemTypes()) {
				if (counters.interrupted) {
					break;
				}
				collection = pullItemType(collection, itemType, request, now, counters);
			}
		}

		PullResult result = new PullResult(key, counters.windows, counters.fetched, counters.inserted,
				counters.updated, counters.rejected, counters.contentChanged, counters.interrupted);
		logger.info("Pull of {} finished: {} windows, {} fetched, {} inserted, {} updated, {} rejected{}", key,
				result.windows(), result.fetched(), result.inserted(), result.updated(), result.rejected(),
				result.interrupted() ? " (interrupted)" : "");
		return result;
	}

	private IssueCollection pullItemType(IssueCollection collection, ItemType itemType, IngestionRequest request,
			Instant now, Counters counters) {
		CollectionKey key = collection.key();
		FetchCheckpoint checkpoint = collection.checkpointOrInitial(itemType, defaultStartDate);
		if (request.startDate() != null && !request.startDate().equals(checkpoint.startDate())) {
			checkpoint = new FetchCheckpoint(itemType, request.startDate(), checkpoint.lastWindowEnd());
		}

		Iterator<FetchWindow> windows = planner.plan(checkpoint, now, request.forced()).iterator();
		while (windows.hasNext()) {
			if (Thread.currentThread().isInterrupted()) {
				logger.warn("Pull of {} {} interrupted, resuming from {} next time", key, itemType.id(),
						checkpoint.resumeFrom());
				counters.interrupted = true;
				break;
			}
			FetchWindow window = windows.next();
			List<JsonNode> batch;
			try {
				batch = source.fetch(key.repository(), Set.of(itemType), window.start(), window.end());
			}
			catch (Retrier.RetryInterruptedException e) {
				logger.warn("Pull of {} {} interrupted while fetching {}", key, itemType.id(), window);
				counters.interrupted = true;
				Thread.currentThread().interrupt();
				break;
			}
			catch (SourceUnavailableException | SourceAuthenticationException e) {
				logger.error("Fetching {} {} {} failed, checkpoint stays at {}", key, itemType.id(), window,
						checkpoint.resumeFrom());
				throw e;
			}

			MergeResult merge = mergeEngine.merge(collection, batch);
			IssueCollection next = merge.collection();
			FetchCheckpoint advanced = window.complete() ? checkpoint.advancedTo(window.end()) : checkpoint;
			boolean checkpointMoved = !advanced.equals(collection.checkpoint(itemType).orElse(null));
			if (checkpointMoved) {
				next = next.withCheckpoint(advanced);
			}
			if (merge.changed() || checkpointMoved) {
				store.save(next);
			}
			checkpoint = advanced;
			collection = next;

			counters.windows++;
			counters.fetched += batch.size();
			counters.inserted += merge.inserted().size();
			counters.updated += merge.updated().size();
			counters.rejected += merge.rejected();
			counters.contentChanged.addAll(merge.contentChanged());
			logger.info("{} {} {}: {} fetched, {} inserted, {} updated", key, itemType.id(), window, batch.size(),
					merge.inserted().size(), merge.updated().size());
		}
		return collection;
	}

	private static final class Counters {

		int windows;

		int fetched;

		int inserted;

		int updated;

		int rejected;

		final Set<Integer> contentChanged = new TreeSet<>();

		boolean interrupted;

	}

}
