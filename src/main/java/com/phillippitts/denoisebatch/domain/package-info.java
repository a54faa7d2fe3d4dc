/**
 * Domain model of the batch pipeline.
 *
 * <p>Most types are immutable records validated in their compact constructors:
 * engine configuration variants, output and session options, audio buffers, media metadata and
 * preview types. {@link com.phillippitts.denoisebatch.domain.Job} is the exception: its status
 * record is mutated through explicit transitions as it moves through the queue.
 */
package com.phillippitts.denoisebatch.domain;
