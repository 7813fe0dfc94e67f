package com.semsort.pipeline;

import com.semsort.queue.NonRetryableJobException;

/**
 * The model returned a vector with the wrong dimensionality or non-finite components.
 */
public class VectorValidationException extends NonRetryableJobException {
    public VectorValidationException(String message) {
        super(message);
    }
}
