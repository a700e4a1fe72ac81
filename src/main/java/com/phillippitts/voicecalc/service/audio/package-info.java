/**
 * PCM format constants, energy measurement and WAV serialization.
 */
package com.phillippitts.voicecalc.service.audio;
