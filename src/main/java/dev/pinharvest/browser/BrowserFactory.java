package dev.pinharvest.browser;

/** Opens browser sessions; launch failures are {@link BrowserLaunchException}s */
@FunctionalInterface
public interface BrowserFactory {
	BrowserAutomation open();
}
