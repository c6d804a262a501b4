/**
 * Root API for the dialer: admission control and scheduling for outbound peer dials.
 *
 * <h2>Core Design</h2>
 * <p>Every {@link dialer.DialRequest} is buffered in a per-peer
 * {@linkplain dialer.queue.DialQueue queue}. The {@linkplain dialer.queue.DialQueueManager manager}
 * admits peers into a bounded number of parallel dial slots, always serving peers with a
 * protocol-bearing (<em>hot</em>) request before peers with only speculative
 * (<em>cold call</em>) requests, FIFO within each class. Cold calls are subject to
 * backpressure. Peers that are already connected skip the queue entirely. A periodic sweep
 * evicts queues that are no longer worth keeping in memory.
 *
 * <p>Every request's {@link dialer.DialCallback} receives exactly one
 * {@link dialer.DialResult}; failures carry a {@link dialer.DialException.Code}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>dialer-core</b> — API, SPIs, manager and default queue (zero external deps)</li>
 *   <li><b>dialer-micrometer</b> — {@linkplain dialer.spi.MetricsExporter metrics} bridge</li>
 * </ul>
 */
package dialer;
