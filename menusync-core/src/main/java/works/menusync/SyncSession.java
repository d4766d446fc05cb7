package works.menusync;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.menusync.batch.PropertyRequestBatcher;
import works.menusync.exceptions.ProtocolMismatchException;
import works.menusync.exceptions.SessionShutdownException;
import works.menusync.exceptions.TransportFailureException;
import works.menusync.logging.MappedDiagnosticContext.MDCScope;
import works.menusync.reconcile.FetchScheduler;
import works.menusync.reconcile.ReconcileReport;
import works.menusync.reconcile.StructureListener;
import works.menusync.reconcile.TreeReconciler;
import works.menusync.transport.LayoutReply;
import works.menusync.transport.MenuTransport;
import works.menusync.transport.NodeProperties;
import works.menusync.transport.RemoteMenuListener;
import works.menusync.transport.RemovedProperties;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static works.menusync.MenuNode.ROOT_ID;
import static works.menusync.logging.MappedDiagnosticContext.setupMDC;

/**
 * Keeps a local {@link MenuTree} in step with a menu owned by a remote process.
 *
 * <p>
 * The session tracks two revision numbers: the one the remote side last announced,
 * and the one the local tree reflects. Whenever the remote one gets ahead, the session
 * fetches the layout and {@link TreeReconciler reconciles} the tree against it.
 * At most one layout fetch is outstanding at a time; a revision announced while one is
 * in flight causes exactly one follow-up fetch when it completes.
 *
 * <p>
 * Everything happens on the {@link Executor} passed to {@link #open}, which must run
 * tasks one at a time. The {@link RemoteMenuListener} methods and the public operations
 * must be called on that executor too. Remote calls may complete on any thread;
 * their results are handed back to the executor before they touch the tree.
 *
 * <p>
 * Failures never escape the session. A failed layout fetch leaves the current tree in
 * place; a failed property fetch leaves that node as it was. Either way, the session
 * stays ready for the next refresh.
 */
public class SyncSession implements RemoteMenuListener, AutoCloseable {
	private final String name;
	private final MenuTransport transport;
	private final Executor eventLoop;
	private final SyncSettings settings;
	private final MenuTree tree = new MenuTree();
	private final TypeHandlerRegistry typeHandlers = new TypeHandlerRegistry();
	private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();
	private final PropertyRequestBatcher batcher;
	private final TreeReconciler reconciler;

	/**
	 * Remote calls other than layout and property fetches, mapped to the future handed to the caller.
	 */
	private final Map<CompletableFuture<?>, CompletableFuture<?>> outstandingCalls = new IdentityHashMap<>();

	/**
	 * Nodes whose properties have arrived while their parent is still unrealized.
	 * They're realized along with the parent.
	 */
	private final Set<MenuNode> awaitingParent = Collections.newSetFromMap(new IdentityHashMap<>());

	private AutoCloseable subscription = null;
	private long remoteRevision = 0;
	private long localRevision = 0;

	/**
	 * Bumped whenever the tree is dropped, so that replies to calls
	 * made for the old tree can be recognized and ignored.
	 */
	private long generation = 0;

	/**
	 * Non-null while a refresh is in flight.
	 */
	private CompletableFuture<LayoutReply> layoutCall = null;

	/**
	 * Whether the transport last reported the remote menu as present.
	 */
	private boolean remotePresent = false;

	private boolean closed = false;

	protected SyncSession(String name, MenuTransport transport, Executor eventLoop, SyncSettings settings) {
		this.name = requireNonNull(name);
		this.transport = requireNonNull(transport);
		this.eventLoop = requireNonNull(eventLoop);
		this.settings = requireNonNull(settings);
		this.batcher = new PropertyRequestBatcher(name, transport, eventLoop, settings);
		Reconciliation reconciliation = new Reconciliation();
		this.reconciler = new TreeReconciler(tree, reconciliation, reconciliation, settings.refreshRecycledNodes());
	}

	/**
	 * Creates a session and subscribes it to <code>transport</code>'s notifications.
	 * The first refresh happens when the transport reports the remote side is present.
	 */
	public static SyncSession open(String name, MenuTransport transport, Executor eventLoop, SyncSettings settings) {
		SyncSession result = new SyncSession(name, transport, eventLoop, settings);
		try (MDCScope __ = setupMDC(name)) {
			LOGGER.info("Opening session");
			result.subscription = transport.subscribe(result);
		}
		return result;
	}

	public static SyncSession open(String name, MenuTransport transport, Executor eventLoop) {
		return open(name, transport, eventLoop, SyncSettings.defaultSettings());
	}

	public String name() {
		return name;
	}

	public SyncSettings settings() {
		return settings;
	}

	/**
	 * The local mirror. Callers must treat it as read-only.
	 */
	public MenuTree tree() {
		return tree;
	}

	public Optional<MenuNode> root() {
		return tree.root();
	}

	public Optional<MenuNode> findNode(int id) {
		return tree.find(id);
	}

	public List<MenuNode> childrenOf(MenuNode node) {
		return tree.childrenOf(node);
	}

	public Optional<MenuNode> parentOf(MenuNode node) {
		return tree.parentOf(node);
	}

	public long localRevision() {
		return localRevision;
	}

	public long remoteRevision() {
		return remoteRevision;
	}

	public boolean isRefreshInFlight() {
		return layoutCall != null;
	}

	public boolean isRemotePresent() {
		return remotePresent;
	}

	public boolean isClosed() {
		return closed;
	}

	public void addListener(SessionListener listener) {
		listeners.add(requireNonNull(listener));
	}

	public void removeListener(SessionListener listener) {
		listeners.remove(listener);
	}

	/**
	 * @throws IllegalArgumentException if <code>typeTag</code> already has a handler
	 * @see TypeHandlerRegistry#register
	 */
	public void registerTypeHandler(String typeTag, TypeHandler handler) {
		typeHandlers.register(typeTag, handler);
	}

	/**
	 * Fetches the layout unless a fetch is already in flight. There's no need to
	 * queue a second one: the one in flight checks the revisions when it completes.
	 */
	public void requestRefresh() {
		if (closed) {
			return;
		}
		if (!remotePresent) {
			LOGGER.debug("Remote menu not present; not refreshing");
			return;
		}
		if (layoutCall != null) {
			LOGGER.debug("Refresh already in flight");
			return;
		}
		long callGeneration = generation;
		LOGGER.debug("Requesting layout; local revision {}, remote revision {}", localRevision, remoteRevision);
		CompletableFuture<LayoutReply> call = withTimeout(() -> transport.getLayout(ROOT_ID), settings.layoutTimeoutMS());
		layoutCall = call;
		call.whenCompleteAsync((reply, error) -> {
			try (MDCScope __ = setupMDC(name)) {
				onLayoutReply(callGeneration, call, reply, error);
			}
		}, eventLoop);
	}

	@Override
	public void remoteAppeared() {
		if (closed) {
			return;
		}
		try (MDCScope __ = setupMDC(name)) {
			LOGGER.info("Remote menu appeared");
			remotePresent = true;
			requestRefresh();
		}
	}

	/**
	 * Drops the whole tree and forgets both revisions. Replies to anything asked of
	 * the remote side before this point are ignored. Nothing is fetched again until
	 * {@link #remoteAppeared()}.
	 */
	@Override
	public void remoteVanished() {
		if (closed) {
			return;
		}
		try (MDCScope __ = setupMDC(name)) {
			LOGGER.info("Remote menu vanished");
			remotePresent = false;
			generation++;
			cancelLayoutCall();
			boolean hadRoot = tree.root().isPresent();
			tree.clear();
			awaitingParent.clear();
			batcher.abandon(new TransportFailureException("Remote menu vanished"));
			remoteRevision = 0;
			localRevision = 0;
			if (hadRoot) {
				fire(l -> l.rootChanged(null));
			}
			fire(SessionListener::layoutUpdated);
		}
	}

	@Override
	public void layoutUpdated(long revision, int parentId) {
		if (closed) {
			return;
		}
		try (MDCScope __ = setupMDC(name)) {
			LOGGER.debug("Remote revision {} (parent {})", revision, parentId);
			remoteRevision = revision;
			if (remoteRevision > localRevision) {
				requestRefresh();
			}
		}
	}

	@Override
	public void itemPropertyUpdated(int id, String key, PropertyValue value) {
		if (closed) {
			return;
		}
		try (MDCScope __ = setupMDC(name)) {
			Optional<MenuNode> node = tree.find(id);
			if (node.isEmpty()) {
				LOGGER.debug("Property update \"{}\" on id {} which couldn't be found", key, id);
				return;
			}
			setProperty(node.get(), key, value);
		}
	}

	/**
	 * Applies removals before updates, so a key that appears in both ends up set.
	 */
	@Override
	public void itemPropertiesUpdated(List<NodeProperties> updated, List<RemovedProperties> removed) {
		if (closed) {
			return;
		}
		try (MDCScope __ = setupMDC(name)) {
			for (RemovedProperties r : removed) {
				Optional<MenuNode> node = tree.find(r.id());
				if (node.isEmpty()) {
					continue;
				}
				for (String key : r.keys()) {
					LOGGER.debug("Removing property \"{}\" on {}", key, r.id());
					removeProperty(node.get(), key);
				}
			}
			for (NodeProperties u : updated) {
				Optional<MenuNode> node = tree.find(u.id());
				if (node.isEmpty()) {
					LOGGER.debug("Property update on id {} which couldn't be found", u.id());
					continue;
				}
				u.properties().forEach((key, value) -> setProperty(node.get(), key, value.unboxed()));
			}
		}
	}

	/**
	 * Refetches one node's properties and merges them in, without a layout refresh.
	 */
	@Override
	public void itemUpdated(int id) {
		if (closed) {
			return;
		}
		try (MDCScope __ = setupMDC(name)) {
			Optional<MenuNode> found = tree.find(id);
			if (found.isEmpty()) {
				LOGGER.warn("Update for id {} which couldn't be found", id);
				return;
			}
			MenuNode node = found.get();
			LOGGER.debug("Getting properties for updated node {}", id);
			batcher.request(id).whenComplete((properties, error) -> {
				if (!tree.contains(node)) {
					LOGGER.debug("Node {} went away before its properties arrived", id);
				} else if (error != null) {
					LOGGER.warn("Error getting properties on node {}: {}", id, error.getMessage());
				} else {
					properties.forEach((key, value) -> setProperty(node, key, value));
				}
			});
		}
	}

	@Override
	public void itemActivationRequested(int id, long timestamp) {
		if (closed) {
			return;
		}
		try (MDCScope __ = setupMDC(name)) {
			if (tree.root().isEmpty()) {
				LOGGER.warn("Asked to activate item {} when we don't have a menu structure", id);
				return;
			}
			Optional<MenuNode> node = tree.find(id);
			if (node.isEmpty()) {
				LOGGER.warn("Unable to find menu item {} to activate", id);
			} else if (!node.get().isRealized()) {
				LOGGER.warn("Asked to activate menu item {} before it was realized", id);
			} else {
				fire(l -> l.itemActivationRequested(node.get(), timestamp));
			}
		}
	}

	/**
	 * Tells the remote side that something happened to a node, such as a click.
	 *
	 * @param data sent as <code>IntValue(0)</code> if null
	 * @return completes when the remote side has replied, or exceptionally with
	 * {@link TransportFailureException}. Either way, {@link SessionListener#eventResult}
	 * fires first.
	 */
	public CompletableFuture<Void> sendEvent(int id, String eventName, PropertyValue data, long timestamp) {
		requireNonNull(eventName);
		if (closed) {
			return CompletableFuture.failedFuture(new SessionShutdownException(name));
		}
		Optional<MenuNode> found = tree.find(id);
		if (found.isEmpty()) {
			LOGGER.warn("Asked to send \"{}\" to menu item {} that we don't know about", eventName, id);
			return CompletableFuture.failedFuture(new IllegalArgumentException("No menu item with id " + id));
		}
		MenuNode node = found.get();
		PropertyValue payload = (data == null) ? PropertyValue.of(0) : data;
		CompletableFuture<Void> result = new CompletableFuture<>();
		CompletableFuture<Void> call = withTimeout(() -> transport.event(id, eventName, payload, timestamp), settings.eventTimeoutMS());
		outstandingCalls.put(call, result);
		call.whenCompleteAsync((__, error) -> {
			if (outstandingCalls.remove(call) == null) {
				return;
			}
			try (MDCScope scope = setupMDC(name)) {
				TransportFailureException failure = (error == null) ? null : TransportFailureException.from("Event", error);
				if (failure != null) {
					LOGGER.warn("Unable to call event \"{}\" on menu item {}: {}", eventName, id, failure.getMessage());
				}
				fire(l -> l.eventResult(node, eventName, payload, timestamp, failure));
				if (failure == null) {
					result.complete(null);
				} else {
					result.completeExceptionally(failure);
				}
			}
		}, eventLoop);
		return result;
	}

	/**
	 * Tells the remote side that node <code>id</code>'s submenu is about to be shown,
	 * and refreshes the layout if it says that changed anything.
	 *
	 * @return whether a refresh was needed. A failed call is logged and counts as false.
	 */
	public CompletableFuture<Boolean> aboutToShow(int id) {
		if (closed) {
			return CompletableFuture.failedFuture(new SessionShutdownException(name));
		}
		CompletableFuture<Boolean> result = new CompletableFuture<>();
		CompletableFuture<Boolean> call = withTimeout(() -> transport.aboutToShow(id), settings.aboutToShowTimeoutMS());
		outstandingCalls.put(call, result);
		call.whenCompleteAsync((needUpdate, error) -> {
			if (outstandingCalls.remove(call) == null) {
				return;
			}
			try (MDCScope __ = setupMDC(name)) {
				boolean update = false;
				if (error != null) {
					LOGGER.warn("Unable to send about-to-show for {}: {}", id, TransportFailureException.from("AboutToShow", error).getMessage());
				} else {
					update = Boolean.TRUE.equals(needUpdate);
				}
				if (update) {
					requestRefresh();
				}
				result.complete(update);
			}
		}, eventLoop);
		return result;
	}

	/**
	 * Tears the session down. Every caller still waiting on the session hears about it
	 * through a {@link SessionShutdownException}, and every type handler is released.
	 */
	@Override
	public void close() {
		if (closed) {
			return;
		}
		try (MDCScope __ = setupMDC(name)) {
			LOGGER.info("Closing session");
			closed = true;
			generation++;
			cancelLayoutCall();
			if (subscription != null) {
				try {
					subscription.close();
				} catch (Exception e) {
					LOGGER.warn("Unable to unsubscribe from transport", e);
				}
				subscription = null;
			}
			tree.clear();
			awaitingParent.clear();
			SessionShutdownException shutdown = new SessionShutdownException(name);
			batcher.abandon(shutdown);
			List<Map.Entry<CompletableFuture<?>, CompletableFuture<?>>> calls = new ArrayList<>(outstandingCalls.entrySet());
			outstandingCalls.clear();
			for (var entry : calls) {
				entry.getKey().cancel(false);
				entry.getValue().completeExceptionally(shutdown);
			}
			typeHandlers.releaseAll();
		}
	}

	private void onLayoutReply(long callGeneration, CompletableFuture<LayoutReply> call, LayoutReply reply, Throwable error) {
		if (callGeneration != generation || call != layoutCall) {
			LOGGER.debug("Ignoring stale layout reply from generation {}", callGeneration);
			return;
		}
		layoutCall = null;
		if (error != null) {
			LOGGER.warn("Getting layout failed: {}", TransportFailureException.from("GetLayout", error).getMessage());
			return;
		}

		// Keep one batch from mixing requests for two different layouts
		batcher.flush();

		MenuNode oldRoot = tree.root().orElse(null);
		ReconcileReport report;
		try {
			report = reconciler.reconcile(reply.layout());
		} catch (ProtocolMismatchException e) {
			LOGGER.warn("Unable to apply layout at revision {}; keeping revision {}", reply.revision(), localRevision, e);
			return;
		}

		localRevision = reply.revision();
		if (remoteRevision < localRevision) {
			remoteRevision = localRevision;
		}
		MenuNode newRoot = report.root();
		if (newRoot != oldRoot) {
			LOGGER.info("Root changed to node {} at revision {}", newRoot.id(), localRevision);
			fire(l -> l.rootChanged(newRoot));
		}
		fire(SessionListener::layoutUpdated);

		if (localRevision < remoteRevision) {
			LOGGER.debug("Revision {} arrived during refresh; refreshing again", remoteRevision);
			requestRefresh();
		}
	}

	private void cancelLayoutCall() {
		if (layoutCall != null) {
			CompletableFuture<LayoutReply> call = layoutCall;
			layoutCall = null;
			call.cancel(false);
		}
	}

	private void setProperty(MenuNode node, String key, PropertyValue value) {
		if (node.setProperty(key, value) && node.isRealized()) {
			fire(l -> l.propertyChanged(node, key, Optional.of(value)));
		}
	}

	private void removeProperty(MenuNode node, String key) {
		if (node.removeProperty(key) && node.isRealized()) {
			fire(l -> l.propertyChanged(node, key, Optional.empty()));
		}
	}

	private void fire(Consumer<SessionListener> action) {
		for (SessionListener listener : listeners) {
			try {
				action.accept(listener);
			} catch (RuntimeException e) {
				LOGGER.warn("Session listener {} threw", listener, e);
			}
		}
	}

	private static <T> CompletableFuture<T> withTimeout(Supplier<CompletableFuture<T>> call, long timeoutMS) {
		CompletableFuture<T> result;
		try {
			result = call.get();
		} catch (RuntimeException e) {
			result = CompletableFuture.failedFuture(e);
		}
		if (timeoutMS > 0) {
			result.orTimeout(timeoutMS, MILLISECONDS);
		}
		return result;
	}

	/**
	 * Carries out what the {@link TreeReconciler} asks for.
	 */
	private final class Reconciliation implements FetchScheduler, StructureListener {
		@Override
		public void fetchNew(MenuNode node, MenuNode parent) {
			batcher.request(node.id()).whenComplete((properties, error) -> realize(node, properties, error));
		}

		@Override
		public void refresh(MenuNode node) {
			batcher.request(node.id()).whenComplete((properties, error) -> replaceProperties(node, properties, error));
		}

		@Override
		public void flush() {
			batcher.flush();
		}

		@Override
		public void childAdded(MenuNode parent, MenuNode child, int position) {
			// Announced once realized
		}

		@Override
		public void childRemoved(MenuNode parent, MenuNode child, List<MenuNode> removed) {
			removed.forEach(awaitingParent::remove);
			if (parent != null && child.isRealized()) {
				fire(l -> l.childRemoved(parent, child));
			}
		}

		@Override
		public void childMoved(MenuNode parent, MenuNode child, int newPosition, int oldPosition) {
			if (child.isRealized()) {
				fire(l -> l.childMoved(parent, child, newPosition, oldPosition));
			}
		}

		private void realize(MenuNode node, Map<String, PropertyValue> properties, Throwable error) {
			if (!tree.contains(node)) {
				LOGGER.debug("Node {} went away before its properties arrived", node.id());
				return;
			}
			if (error != null) {
				LOGGER.warn("Error getting properties on new node {}: {}", node.id(), error.getMessage());
				return;
			}
			properties.forEach(node::setProperty);
			MenuNode parent = tree.parentOf(node).orElse(null);
			if (parent != null && !parent.isRealized()) {
				LOGGER.debug("Holding node {} until its parent {} is realized", node.id(), parent.id());
				awaitingParent.add(node);
				return;
			}
			announce(node);
		}

		/**
		 * Realizes <code>node</code>, then any descendants that were only waiting on it,
		 * parents before children and siblings in order.
		 */
		private void announce(MenuNode node) {
			Deque<MenuNode> work = new ArrayDeque<>();
			work.push(node);
			while (!work.isEmpty()) {
				MenuNode next = work.pop();
				MenuNode parent = tree.parentOf(next).orElse(null);
				boolean handled = typeHandlers.dispatch(next, parent, SyncSession.this);
				next.markRealized();
				LOGGER.trace("Realized node {}", next.id());
				if (parent != null) {
					int position = parent.childIds().indexOf(next.id());
					fire(l -> l.childAdded(parent, next, position));
				}
				if (!handled) {
					fire(l -> l.newNode(next));
				}
				List<MenuNode> children = tree.childrenOf(next);
				for (int i = children.size() - 1; i >= 0; i--) {
					MenuNode child = children.get(i);
					if (awaitingParent.remove(child)) {
						work.push(child);
					}
				}
			}
		}

		private void replaceProperties(MenuNode node, Map<String, PropertyValue> properties, Throwable error) {
			if (!tree.contains(node)) {
				LOGGER.debug("Node {} went away before its properties arrived", node.id());
				return;
			}
			if (error != null) {
				LOGGER.warn("Unable to replace properties on {}: {}", node.id(), error.getMessage());
				return;
			}
			if (!node.isRealized()) {
				// Never announced, so the changes stay quiet
				for (String key : List.copyOf(node.propertyKeys())) {
					if (!properties.containsKey(key)) {
						node.removeProperty(key);
					}
				}
				realize(node, properties, null);
				return;
			}
			for (String key : List.copyOf(node.propertyKeys())) {
				if (!properties.containsKey(key)) {
					removeProperty(node, key);
				}
			}
			properties.forEach((key, value) -> setProperty(node, key, value));
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SyncSession.class);
}
