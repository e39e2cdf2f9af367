/**
 * Spring configuration: {@code @ConfigurationProperties} per concern and the bean
 * wiring of the pipeline ({@link com.phillippitts.voiceinput.config.DictationConfig}).
 */
package com.phillippitts.voiceinput.config;
