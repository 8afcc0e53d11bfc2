package dev.pinharvest.browser;

/** The browser could not be started; a setup failure that ends the run */
public class BrowserLaunchException extends RuntimeException {
	public BrowserLaunchException(String message, Throwable cause) {
		super(message, cause);
	}
}
