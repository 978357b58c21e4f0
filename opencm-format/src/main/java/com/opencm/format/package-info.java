/**
 * OpenCM file format: validation, parsing and serialization of {@code *.opencm.json} documents.
 *
 * <ul>
 *   <li>{@link com.opencm.format.validation} – {@link com.opencm.format.validation.OpenCmValidator}
 *       (errors block loading, warnings do not) and cycle detection</li>
 *   <li>{@link com.opencm.format.parse} – JSON tree to {@link com.opencm.model.CausalModel}, filling defaults</li>
 *   <li>{@link com.opencm.format.serialize} – {@link com.opencm.model.CausalModel} to JSON tree, omitting defaults</li>
 *   <li>{@link com.opencm.format.load} – {@link com.opencm.format.load.OpenCmLoader#load load},
 *       {@link com.opencm.format.load.OpenCmLoader#validateOnly validateOnly},
 *       {@link com.opencm.format.load.OpenCmLoader#save save}</li>
 *   <li>{@link com.opencm.format.catalog} – listing the models in a directory</li>
 * </ul>
 */
package com.opencm.format;
