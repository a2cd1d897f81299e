package com.lottointel.activo.model;

import java.time.LocalDate;
import java.time.LocalTime;

/** Identity of a draw event. */
public record DrawKey(LocalDate date, LocalTime time, String number) {}
