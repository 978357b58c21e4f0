/**
 * File-level operations: load (read, validate, parse), validate only, and save.
 */
package com.opencm.format.load;
