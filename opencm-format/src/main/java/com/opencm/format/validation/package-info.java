/**
 * Validation of OpenCM documents: {@link com.opencm.format.validation.OpenCmValidator} produces a
 * {@link com.opencm.format.validation.ValidationResult} per call; {@link com.opencm.format.validation.CycleDetector}
 * finds directed cycles in the edge graph.
 */
package com.opencm.format.validation;
