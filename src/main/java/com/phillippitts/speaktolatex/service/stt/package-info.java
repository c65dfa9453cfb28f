/**
 * Speech-to-text seam. No engine ships with the application; deployments provide an
 * {@link com.phillippitts.speaktolatex.service.stt.SttEngine} bean.
 */
package com.phillippitts.speaktolatex.service.stt;
