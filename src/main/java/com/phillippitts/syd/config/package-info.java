/**
 * Spring configuration: typed properties, the star executor and the parameter defaults.
 */
package com.phillippitts.syd.config;
