package dev.pinharvest.testing;

import dev.pinharvest.extract.PinExtractor;
import dev.pinharvest.model.Pin;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** Returns scripted batches of pins, one batch per extraction, then empty lists */
public class ScriptedExtractor implements PinExtractor {
	private final Deque<List<Pin>> batches = new ArrayDeque<>();
	private final List<Runnable> afterBatch = new ArrayList<>();
	private int calls;

	@SafeVarargs
	public ScriptedExtractor(List<Pin>... batches) {
		for (List<Pin> batch : batches) {
			this.batches.add(batch);
		}
	}

	/** Run an action once the batch with this 1-based index was handed out */
	public ScriptedExtractor then(int batch, Runnable action) {
		while (afterBatch.size() < batch) {
			afterBatch.add(null);
		}
		afterBatch.set(batch - 1, action);
		return this;
	}

	@Override
	public List<Pin> extractRecords(String html) {
		calls++;
		List<Pin> batch = batches.isEmpty() ? List.of() : batches.poll();
		if (calls <= afterBatch.size() && afterBatch.get(calls - 1) != null) {
			afterBatch.get(calls - 1).run();
		}
		return batch;
	}

	public int calls() {
		return calls;
	}
}
