package io.vena.docsync.util;

/**
 * Keys for the SLF4J mapped diagnostic context entries written by this library.
 */
public final class MdcKeys {
	public static final String CLIENT      = "docsync.client";
	public static final String TRANSACTION = "docsync.transaction";

	private MdcKeys() { }
}
