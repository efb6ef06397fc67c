package lite.trans.passes.scan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import lite.util.SourceLocation;
import lite.util.TextEdit;

/**
 * A located occurrence of a rewrite in the current buffer together with its already
 * computed replacement. Offsets are only valid for the buffer the candidate was found in.
 */
public class MatchCandidate extends TextEdit {

	/**
	 * Rightmost first; of two candidates starting at the same offset the shorter, inner one
	 * comes first.
	 */
	public static final Comparator<MatchCandidate> RIGHTMOST_FIRST =
			Comparator.comparingInt(MatchCandidate::getStart).reversed()
					.thenComparingInt(MatchCandidate::getEnd);

	private final String name;
	private final SourceLocation location;

	public MatchCandidate(String name, SourceLocation location, int start, int end, String replacement) {
		super(start, end, replacement);
		this.name = name;
		this.location = location;
	}

	/**
	 * @return the spelling of the rewritten call, such as {@code filter!} or {@code log}
	 */
	public String getName() {
		return name;
	}

	public SourceLocation getLocation() {
		return location;
	}

	/**
	 * Picks the candidates one sweep may apply together: the rightmost candidate, then every
	 * candidate further left whose span does not overlap one already picked. A candidate
	 * enclosing a picked one was computed from text that is about to change, so it waits
	 * for the next sweep.
	 */
	public static List<MatchCandidate> selectRightmostFirst(List<MatchCandidate> candidates) {
		List<MatchCandidate> ordered = new ArrayList<>(candidates);
		ordered.sort(RIGHTMOST_FIRST);
		List<MatchCandidate> selected = new ArrayList<>();
		for(MatchCandidate candidate : ordered) {
			boolean free = true;
			for(MatchCandidate picked : selected) {
				if(candidate.overlaps(picked)) {
					free = false;
					break;
				}
			}
			if(free) {
				selected.add(candidate);
			}
		}
		return selected;
	}

	@Override
	public String toString() {
		return "MatchCandidate [name=" + name + ", start=" + start + ", end=" + end + ", replacement="
				+ replacement + "]";
	}
}
