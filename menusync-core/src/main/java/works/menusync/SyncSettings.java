package works.menusync;

import lombok.With;

/**
 * Tuning knobs for a {@link SyncSession}. Timeouts of zero mean "wait forever".
 *
 * @param layoutTimeoutMS      limit on each <code>GetLayout</code> call.
 *                             Layouts can be large, so this is normally unbounded.
 * @param propertiesTimeoutMS  limit on each <code>GetGroupProperties</code> call.
 * @param eventTimeoutMS       limit on each <code>Event</code> call. These are
 *                             user-triggered, so a stuck remote side should be noticed quickly.
 * @param aboutToShowTimeoutMS limit on each <code>AboutToShow</code> call.
 * @param maxQueuedProperties  how many property requests can accumulate before the batch
 *                             is sent without waiting for the next tick of the event loop.
 * @param refreshRecycledNodes whether nodes kept across a layout change get their
 *                             properties refetched. Turning this off saves round trips
 *                             when the remote side reliably announces property changes itself.
 */
@With
public record SyncSettings(
	long layoutTimeoutMS,
	long propertiesTimeoutMS,
	long eventTimeoutMS,
	long aboutToShowTimeoutMS,
	int maxQueuedProperties,
	boolean refreshRecycledNodes
) {
	public SyncSettings {
		checkTimeout("layoutTimeoutMS", layoutTimeoutMS);
		checkTimeout("propertiesTimeoutMS", propertiesTimeoutMS);
		checkTimeout("eventTimeoutMS", eventTimeoutMS);
		checkTimeout("aboutToShowTimeoutMS", aboutToShowTimeoutMS);
		if (maxQueuedProperties < 1) {
			throw new IllegalArgumentException("maxQueuedProperties must be positive: " + maxQueuedProperties);
		}
	}

	public static SyncSettings defaultSettings() {
		return new SyncSettings(0, 0, 1000, 0, 100, true);
	}

	private static void checkTimeout(String name, long value) {
		if (value < 0) {
			throw new IllegalArgumentException(name + " can't be negative: " + value);
		}
	}
}
