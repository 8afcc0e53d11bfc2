package dev.pinharvest.download;

import java.nio.file.Path;
import java.util.List;

/** A scheduled download: the persisted task, its candidate URLs in order and the target file */
public record DownloadJob(long taskId, String pinId, List<String> candidates, Path target) {}
