package com.example.dispatcher.model;

public enum ScheduleStatus {
  PENDENTE,
  AGENDADA,
  ENVIADA,
  ERRO
}
