/**
 * Typed representation of an OpenCM structural causal model.
 *
 * <ul>
 *   <li>{@link com.opencm.model.CausalModel} – root: identity, variables, edges, equations, assumptions</li>
 *   <li>{@link com.opencm.model.Variable}, {@link com.opencm.model.Edge}, {@link com.opencm.model.Equation} – graph parts</li>
 *   <li>{@link com.opencm.model.ValidationRequirements}, {@link com.opencm.model.ModelMetadata} – optional sections</li>
 *   <li>{@link com.opencm.model.VariableType}, {@link com.opencm.model.EdgeType}, {@link com.opencm.model.EquationType},
 *       {@link com.opencm.model.ModelDomain} – closed kinds with an {@code UNKNOWN} fallback</li>
 * </ul>
 * No type here checks cross references; see the validator in {@code com.opencm.format.validation}.
 */
package com.opencm.model;
