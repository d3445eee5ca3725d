package com.example.harmonicmixer.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TempoChange {

    private double timeSeconds;

    private double bpm;
}
