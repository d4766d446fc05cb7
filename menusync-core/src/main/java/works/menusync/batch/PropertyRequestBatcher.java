package works.menusync.batch;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.menusync.PropertyValue;
import works.menusync.SyncSettings;
import works.menusync.exceptions.DuplicateRequestException;
import works.menusync.exceptions.PropertiesUnavailableException;
import works.menusync.exceptions.TransportFailureException;
import works.menusync.logging.MappedDiagnosticContext.MDCScope;
import works.menusync.transport.MenuTransport;
import works.menusync.transport.NodeProperties;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static works.menusync.logging.MappedDiagnosticContext.setupMDC;

/**
 * Collects per-node property requests made during one tick of the event loop
 * and sends them as a single {@link MenuTransport#getGroupProperties} call,
 * then hands each node's share of the reply to the future returned by {@link #request}.
 *
 * <p>
 * A batch goes out at the next tick after its first request, when it reaches
 * {@link SyncSettings#maxQueuedProperties()} entries, or when {@link #flush()}
 * is called, whichever comes first. Every returned future completes exactly once:
 * with the node's properties, or with a {@link DuplicateRequestException},
 * {@link PropertiesUnavailableException}, {@link TransportFailureException},
 * or whatever was passed to {@link #abandon}.
 *
 * <p>
 * Not thread-safe: call only on the event loop, which is also where
 * replies are processed.
 */
public class PropertyRequestBatcher {
	private final String sessionName;
	private final MenuTransport transport;
	private final Executor eventLoop;
	private final SyncSettings settings;
	private long batchCounter = 0;
	private final Set<Batch> inFlight = new LinkedHashSet<>();
	private Batch pending = newBatch();

	public PropertyRequestBatcher(String sessionName, MenuTransport transport, Executor eventLoop, SyncSettings settings) {
		this.sessionName = sessionName;
		this.transport = transport;
		this.eventLoop = eventLoop;
		this.settings = settings;
	}

	private static final class Batch {
		final long number;
		final Map<Integer, Listener> listeners = new LinkedHashMap<>();
		boolean tickScheduled = false;
		CompletableFuture<List<NodeProperties>> call;

		Batch(long number) {
			this.number = number;
		}
	}

	private static final class Listener {
		final int id;
		final CompletableFuture<Map<String, PropertyValue>> future = new CompletableFuture<>();
		boolean replied = false;

		Listener(int id) {
			this.id = id;
		}

		void fail(Throwable cause) {
			replied = true;
			future.completeExceptionally(cause);
		}
	}

	/**
	 * Queues a request for all of node <code>id</code>'s properties.
	 *
	 * @return a future for the properties. If <code>id</code> is already queued in
	 * the current batch, the result is already failed with {@link DuplicateRequestException}
	 * and the earlier request is unaffected.
	 */
	public CompletableFuture<Map<String, PropertyValue>> request(int id) {
		if (pending.listeners.containsKey(id)) {
			LOGGER.warn("Asking for properties from same id twice: {}", id);
			return CompletableFuture.failedFuture(new DuplicateRequestException(id));
		}
		Listener listener = new Listener(id);
		pending.listeners.put(id, listener);
		if (!pending.tickScheduled) {
			pending.tickScheduled = true;
			Batch scheduled = pending;
			eventLoop.execute(() -> onTick(scheduled));
		}
		if (pending.listeners.size() >= settings.maxQueuedProperties()) {
			LOGGER.debug("Batch {} reached {} requests; flushing early", pending.number, pending.listeners.size());
			flush();
		}
		return listener.future;
	}

	/**
	 * Sends the current batch now, if it has anything in it.
	 */
	public void flush() {
		if (pending.listeners.isEmpty()) {
			return;
		}
		Batch batch = pending;
		pending = newBatch();
		inFlight.add(batch);

		List<Integer> ids = new ArrayList<>(batch.listeners.keySet());
		LOGGER.debug("Sending batch {} with {} id{}", batch.number, ids.size(), (ids.size() >= 2) ? "s" : "");
		CompletableFuture<List<NodeProperties>> call;
		try {
			call = transport.getGroupProperties(ids, List.of());
		} catch (RuntimeException e) {
			call = CompletableFuture.failedFuture(e);
		}
		if (settings.propertiesTimeoutMS() > 0) {
			call.orTimeout(settings.propertiesTimeoutMS(), MILLISECONDS);
		}
		batch.call = call;
		call.whenCompleteAsync((reply, error) -> onReply(batch, reply, error), eventLoop);
	}

	/**
	 * Fails every waiting request, queued or already sent, with <code>cause</code>,
	 * and cancels the calls in flight. Replies that arrive afterward are ignored.
	 */
	public void abandon(Throwable cause) {
		List<Batch> victims = new ArrayList<>(inFlight);
		victims.add(pending);
		inFlight.clear();
		pending = newBatch();
		int count = 0;
		for (Batch batch : victims) {
			if (batch.call != null) {
				batch.call.cancel(false);
			}
			for (Listener listener : batch.listeners.values()) {
				if (!listener.replied) {
					listener.fail(cause);
					count++;
				}
			}
		}
		if (count > 0) {
			LOGGER.debug("Abandoned {} property request{}: {}", count, (count >= 2) ? "s" : "", cause.getMessage());
		}
	}

	public int pendingCount() {
		return pending.listeners.size();
	}

	public int inFlightCount() {
		return inFlight.size();
	}

	private void onTick(Batch scheduled) {
		if (scheduled != pending) {
			// Already sent early
			return;
		}
		try (MDCScope __ = setupMDC(sessionName)) {
			flush();
		}
	}

	private void onReply(Batch batch, List<NodeProperties> reply, Throwable error) {
		try (MDCScope __ = setupMDC(sessionName)) {
			if (!inFlight.remove(batch)) {
				LOGGER.debug("Ignoring reply to abandoned batch {}", batch.number);
				return;
			}
			if (error != null) {
				TransportFailureException failure = TransportFailureException.from("GetGroupProperties", error);
				LOGGER.warn("Group properties error for batch {}: {}", batch.number, failure.getMessage());
				batch.listeners.values().forEach(l -> l.fail(failure));
				return;
			}

			for (NodeProperties entry : reply) {
				Listener listener = batch.listeners.get(entry.id());
				if (listener == null) {
					LOGGER.warn("Unable to find listener for id {}", entry.id());
				} else if (listener.replied) {
					LOGGER.warn("Already replied to the listener on id {}", entry.id());
				} else {
					listener.replied = true;
					listener.future.complete(entry.properties());
				}
			}

			for (Listener listener : batch.listeners.values()) {
				if (!listener.replied) {
					LOGGER.warn("Generating properties error for id {}", listener.id);
					listener.fail(new PropertiesUnavailableException(listener.id));
				}
			}
		}
	}

	private Batch newBatch() {
		return new Batch(++batchCounter);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(PropertyRequestBatcher.class);
}
