/**
 * Small concurrency helpers shared by the dialer modules.
 */
package dialer.util;
