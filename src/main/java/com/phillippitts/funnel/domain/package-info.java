/**
 * Immutable domain model shared by the client and relay roles.
 *
 * <p>Records validate their invariants in compact constructors; empty transcript text is
 * always valid since a silent recording is legitimate input.
 *
 * @since 1.0
 */
package com.phillippitts.funnel.domain;
