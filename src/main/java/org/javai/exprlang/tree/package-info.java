/**
 * Expression syntax trees and their rendering back to text.
 */
@org.springframework.lang.NonNullApi
package org.javai.exprlang.tree;
