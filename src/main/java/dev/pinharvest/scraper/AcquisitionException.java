package dev.pinharvest.scraper;

/** A page could not be loaded, parsed or authenticated against; ends the current phase */
public class AcquisitionException extends Exception {
	public AcquisitionException(String message) {
		super(message);
	}

	public AcquisitionException(String message, Throwable cause) {
		super(message, cause);
	}
}
