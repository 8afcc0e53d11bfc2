package dev.pinharvest.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.Cookie;
import com.microsoft.playwright.options.Proxy;
import com.microsoft.playwright.options.WaitUntilState;
import dev.pinharvest.util.HttpUtils;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link BrowserAutomation} on a Playwright Chromium instance */
public class PlaywrightBrowser implements BrowserAutomation {
	private static final Logger logger = LoggerFactory.getLogger(PlaywrightBrowser.class);
	private static final double NAVIGATION_TIMEOUT_MILLIS = 30_000;

	private final Playwright playwright;
	private final Browser browser;
	private final BrowserContext context;
	private final Page page;
	private final List<CapturedRequest> captured = new CopyOnWriteArrayList<>();

	private PlaywrightBrowser(Playwright playwright, Browser browser, BrowserContext context, Page page) {
		this.playwright = playwright;
		this.browser = browser;
		this.context = context;
		this.page = page;
		page.onRequest(request -> captured.add(
				new CapturedRequest(request.url(), request.method(), new LinkedHashMap<>(request.headers()))));
	}

	/**
	 * Launch Chromium.
	 *
	 * @param headless false shows the browser window, used with {@code --debug}
	 * @param proxy optional proxy server such as {@code http://host:port}, or null
	 * @throws BrowserLaunchException if Playwright or the browser cannot be started
	 */
	public static PlaywrightBrowser launch(boolean headless, String proxy) {
		Playwright playwright = null;
		try {
			playwright = Playwright.create();
			BrowserType.LaunchOptions options = new BrowserType.LaunchOptions().setHeadless(headless);
			if (proxy != null && !proxy.isBlank()) {
				options.setProxy(new Proxy(proxy));
			}
			Browser browser = playwright.chromium().launch(options);
			BrowserContext context = browser.newContext(new Browser.NewContextOptions()
					.setUserAgent(HttpUtils.DEFAULT_USER_AGENT)
					.setViewportSize(1920, 1080)
					.setLocale("en-US"));
			Page page = context.newPage();
			logger.debug("Launched Chromium (headless={}, proxy={})", headless, proxy);
			return new PlaywrightBrowser(playwright, browser, context, page);
		} catch (PlaywrightException e) {
			if (playwright != null) {
				playwright.close();
			}
			throw new BrowserLaunchException("Failed to start browser: " + e.getMessage(), e);
		}
	}

	/** Factory for the settings of one run */
	public static BrowserFactory factory(boolean headless, String proxy) {
		return () -> launch(headless, proxy);
	}

	@Override
	public boolean navigate(String url) {
		try {
			page.navigate(
					url,
					new Page.NavigateOptions()
							.setTimeout(NAVIGATION_TIMEOUT_MILLIS)
							.setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
			return true;
		} catch (PlaywrightException e) {
			logger.warn("Navigation to {} failed: {}", url, e.getMessage());
			return false;
		}
	}

	@Override
	public void scroll(int pixels) {
		page.evaluate("px => window.scrollBy(0, px)", pixels);
	}

	@Override
	public String getPageSource() {
		return page.content();
	}

	@Override
	public boolean waitForSelector(String selector, Duration timeout) {
		try {
			page.waitForSelector(selector, new Page.WaitForSelectorOptions().setTimeout(timeout.toMillis()));
			return true;
		} catch (PlaywrightException e) {
			logger.debug("Selector {} not found within {}: {}", selector, timeout, e.getMessage());
			return false;
		}
	}

	@Override
	public List<CapturedRequest> capturedRequests() {
		return new ArrayList<>(captured);
	}

	@Override
	public Map<String, String> cookies() {
		Map<String, String> cookies = new LinkedHashMap<>();
		for (Cookie cookie : context.cookies()) {
			cookies.put(cookie.name, cookie.value);
		}
		return cookies;
	}

	@Override
	public String userAgent() {
		Object agent = page.evaluate("() => navigator.userAgent");
		return agent != null ? agent.toString() : HttpUtils.DEFAULT_USER_AGENT;
	}

	@Override
	public void close() {
		try {
			context.close();
			browser.close();
		} catch (PlaywrightException e) {
			logger.warn("Failed to close browser cleanly: {}", e.getMessage());
		} finally {
			playwright.close();
		}
	}
}
