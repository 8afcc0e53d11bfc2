package dev.pinharvest.extract;

import dev.pinharvest.model.Pin;
import java.util.List;

/** Turns a rendered page into pin records; implementations hold no state between calls */
@FunctionalInterface
public interface PinExtractor {
	List<Pin> extractRecords(String html);
}
