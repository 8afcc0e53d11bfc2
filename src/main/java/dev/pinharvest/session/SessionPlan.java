package dev.pinharvest.session;

/**
 * Outcome of {@link SessionManager#startOrResume}.
 *
 * @param sessionId the session the run reports into
 * @param cachedCount pins already stored for the keyword
 * @param remaining pins acquisition still has to deliver
 * @param resumed true if an earlier incomplete session was picked up
 * @param satisfied true if the store already holds enough pins and no acquisition is needed
 */
public record SessionPlan(String sessionId, int cachedCount, int remaining, boolean resumed, boolean satisfied) {}
