/**
 * Integration with Jackson's tree model.
 */
package works.convey.jackson;
